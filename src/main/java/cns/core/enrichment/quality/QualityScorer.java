package cns.core.enrichment.quality;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Blends tier-weighted completeness, tier-weighted field confidence and match confidence
 * into a single score. Adding a present field never lowers the score and lowering a
 * field's confidence never raises it.
 */
@Component
public class QualityScorer {

    public QualityScore score(ComparisonResult comparison, double matchConfidence, ScoringWeights weights) {
        double completeness = 0.0;
        double confidence = 0.0;
        for (FieldTier tier : FieldTier.values()) {
            List<ComponentField> fields = ComponentField.inTier(tier);
            int present = 0;
            double confidenceSum = 0.0;
            for (ComponentField field : fields) {
                FieldDiff diff = comparison.diff(field);
                if (diff != null && diff.present()) {
                    present++;
                    confidenceSum += diff.confidence();
                }
            }
            double tierWeight = weights.tierWeight(tier);
            completeness += tierWeight * present / fields.size();
            confidence += tierWeight * confidenceSum / fields.size();
        }

        double match = clamp(matchConfidence);
        double total = weights.completeness() + weights.confidence() + weights.match();
        double blended = (weights.completeness() * completeness
                + weights.confidence() * confidence
                + weights.match() * match) / total;
        double overall = Math.round(clamp(blended) * 10000.0) / 100.0;
        return new QualityScore(overall, completeness, confidence, match);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
