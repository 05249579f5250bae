package cns.core.enrichment.domain;

public enum DataQuality {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    public static DataQuality fromConfidence(double confidence) {
        if (confidence >= 0.9) {
            return HIGH;
        }
        if (confidence >= 0.7) {
            return MEDIUM;
        }
        if (confidence > 0.0) {
            return LOW;
        }
        return NONE;
    }
}
