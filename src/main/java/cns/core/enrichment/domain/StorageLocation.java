package cns.core.enrichment.domain;

public enum StorageLocation {
    DATABASE("database"),
    REDIS("redis");

    private final String value;

    StorageLocation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
