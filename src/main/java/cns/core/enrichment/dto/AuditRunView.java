package cns.core.enrichment.dto;

import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.domain.AuditRun;
import cns.core.enrichment.domain.ReviewStatus;
import java.time.Instant;
import java.util.UUID;

public record AuditRunView(UUID id,
                           UUID requestId,
                           UUID batchJobId,
                           String recordKey,
                           String supplierId,
                           AuditOutcome outcome,
                           Double qualityScore,
                           Double matchConfidence,
                           String tier,
                           boolean needsReview,
                           Instant startedAt,
                           long durationMs,
                           String errorMessage,
                           String attemptLog,
                           ReviewStatus reviewStatus,
                           String reviewedBy,
                           String reviewNote,
                           Instant reviewedAt) {
    public static AuditRunView from(AuditRun run) {
        return new AuditRunView(run.getId(), run.getRequestId(), run.getBatchJobId(), run.getRecordKey(),
                run.getSupplierId(), run.getOutcome(), run.getQualityScore(), run.getMatchConfidence(), run.getTier(),
                run.isNeedsReview(), run.getStartedAt(), run.getDurationMs(), run.getErrorMessage(),
                run.getAttemptLog(), run.getReviewStatus(), run.getReviewedBy(), run.getReviewNote(),
                run.getReviewedAt());
    }
}
