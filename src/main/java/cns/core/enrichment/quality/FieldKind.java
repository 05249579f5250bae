package cns.core.enrichment.quality;

public enum FieldKind {
    TEXT,
    URL,
    DECIMAL,
    INTEGER,
    BOOLEAN,
    LIST,
    MAP
}
