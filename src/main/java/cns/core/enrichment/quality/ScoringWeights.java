package cns.core.enrichment.quality;

import cns.core.enrichment.config.EnrichmentProperties;

public record ScoringWeights(
        double completeness,
        double confidence,
        double match,
        double requiredTier,
        double highPriorityTier,
        double recommendedTier) {

    public ScoringWeights {
        if (completeness < 0 || confidence < 0 || match < 0
                || requiredTier < 0 || highPriorityTier < 0 || recommendedTier < 0) {
            throw new IllegalArgumentException("scoring weights must not be negative");
        }
        if (completeness + confidence + match == 0 || requiredTier + highPriorityTier + recommendedTier == 0) {
            throw new IllegalArgumentException("scoring weights must not all be zero");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.5, 0.3, 0.2, 0.50, 0.35, 0.15);
    }

    public static ScoringWeights from(EnrichmentProperties.Scoring scoring) {
        return new ScoringWeights(
                scoring.getCompletenessWeight(),
                scoring.getConfidenceWeight(),
                scoring.getMatchWeight(),
                scoring.getRequiredTierWeight(),
                scoring.getHighPriorityTierWeight(),
                scoring.getRecommendedTierWeight());
    }

    double tierWeight(FieldTier tier) {
        double total = requiredTier + highPriorityTier + recommendedTier;
        double weight = switch (tier) {
            case REQUIRED -> requiredTier;
            case HIGH_PRIORITY -> highPriorityTier;
            case RECOMMENDED -> recommendedTier;
        };
        return weight / total;
    }
}
