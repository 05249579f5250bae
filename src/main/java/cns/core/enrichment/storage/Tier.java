package cns.core.enrichment.storage;

public enum Tier {
    CATALOG("catalog"),
    CACHE("cache"),
    UNPLACED("needs_review");

    private final String label;

    Tier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
