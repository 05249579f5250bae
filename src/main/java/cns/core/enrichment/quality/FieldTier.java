package cns.core.enrichment.quality;

public enum FieldTier {
    REQUIRED,
    HIGH_PRIORITY,
    RECOMMENDED
}
