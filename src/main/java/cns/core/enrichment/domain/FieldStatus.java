package cns.core.enrichment.domain;

public enum FieldStatus {
    UNCHANGED,
    CHANGED,
    MISSING,
    INVALID
}
