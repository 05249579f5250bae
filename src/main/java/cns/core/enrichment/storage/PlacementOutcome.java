package cns.core.enrichment.storage;

import cns.core.enrichment.domain.AuditOutcome;

public enum PlacementOutcome {
    PLACED_CATALOG(AuditOutcome.PLACED_CATALOG),
    PROMOTED(AuditOutcome.PLACED_CATALOG),
    PLACED_CACHE(AuditOutcome.PLACED_CACHE),
    RETAINED_CATALOG(AuditOutcome.RETAINED_CATALOG),
    UNCHANGED(AuditOutcome.UNCHANGED),
    NEEDS_REVIEW(AuditOutcome.NEEDS_REVIEW);

    private final AuditOutcome auditOutcome;

    PlacementOutcome(AuditOutcome auditOutcome) {
        this.auditOutcome = auditOutcome;
    }

    public AuditOutcome auditOutcome() {
        return auditOutcome;
    }
}
