package cns.core.enrichment.domain;

public enum ReviewStatus {
    APPROVED,
    REJECTED,
    NEEDS_CORRECTION
}
