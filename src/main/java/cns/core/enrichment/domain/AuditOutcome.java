package cns.core.enrichment.domain;

public enum AuditOutcome {
    PLACED_CATALOG,
    PLACED_CACHE,
    RETAINED_CATALOG,
    UNCHANGED,
    NEEDS_REVIEW,
    EXHAUSTED,
    STORAGE_CONFLICT,
    CANCELLED,
    MANUAL_PROMOTION,
    CACHE_EXPIRED,
    RECONCILED,
    ERROR
}
