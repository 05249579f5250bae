package cns.core.enrichment.domain;

public enum BatchJobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    CANCELLED
}
