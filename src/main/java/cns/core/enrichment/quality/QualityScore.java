package cns.core.enrichment.quality;

public record QualityScore(
        double overall,
        double completeness,
        double fieldConfidence,
        double matchConfidence) {
}
