package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "audit_run", indexes = {
        @Index(name = "idx_audit_run_request", columnList = "request_id"),
        @Index(name = "idx_audit_run_record", columnList = "record_key")
})
public class AuditRun {

    @Id
    private UUID id;

    @Column(name = "request_id", updatable = false)
    private UUID requestId;

    @Column(name = "batch_job_id", updatable = false)
    private UUID batchJobId;

    @Column(name = "organization_id", updatable = false, length = 64)
    private String organizationId;

    @Column(name = "record_key", nullable = false, updatable = false, length = 400)
    private String recordKey;

    @Column(nullable = false, updatable = false, length = 128)
    private String mpn;

    @Column(updatable = false, length = 255)
    private String manufacturer;

    @Column(name = "supplier_id", updatable = false, length = 64)
    private String supplierId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private AuditOutcome outcome;

    @Column(name = "quality_score", updatable = false)
    private Double qualityScore;

    @Column(name = "match_confidence", updatable = false)
    private Double matchConfidence;

    @Column(name = "tier", updatable = false, length = 16)
    private String tier;

    @Column(name = "needs_review", nullable = false, updatable = false)
    private boolean needsReview;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt;

    @Column(name = "duration_ms", nullable = false, updatable = false)
    private long durationMs;

    @Lob
    @Column(name = "error_message", updatable = false)
    private String errorMessage;

    @Lob
    @Column(name = "attempt_log", updatable = false)
    private String attemptLog;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_status", length = 32)
    private ReviewStatus reviewStatus;

    @Column(name = "reviewed_by", length = 128)
    private String reviewedBy;

    @Lob
    @Column(name = "review_note")
    private String reviewNote;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    protected AuditRun() {
    }

    public AuditRun(UUID id, UUID requestId, UUID batchJobId, String organizationId, String recordKey,
                    String mpn, String manufacturer, String supplierId, AuditOutcome outcome,
                    Double qualityScore, Double matchConfidence, String tier, boolean needsReview,
                    Instant startedAt, Instant finishedAt, String errorMessage, String attemptLog) {
        this.id = id;
        this.requestId = requestId;
        this.batchJobId = batchJobId;
        this.organizationId = organizationId;
        this.recordKey = recordKey;
        this.mpn = mpn;
        this.manufacturer = manufacturer;
        this.supplierId = supplierId;
        this.outcome = outcome;
        this.qualityScore = qualityScore;
        this.matchConfidence = matchConfidence;
        this.tier = tier;
        this.needsReview = needsReview;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.durationMs = Math.max(0L, finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        this.errorMessage = errorMessage;
        this.attemptLog = attemptLog;
    }

    public void annotateReview(ReviewStatus status, String reviewer, String note, Instant at) {
        this.reviewStatus = status;
        this.reviewedBy = reviewer;
        this.reviewNote = note;
        this.reviewedAt = at;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public UUID getBatchJobId() {
        return batchJobId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getRecordKey() {
        return recordKey;
    }

    public String getMpn() {
        return mpn;
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public String getSupplierId() {
        return supplierId;
    }

    public AuditOutcome getOutcome() {
        return outcome;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    public Double getMatchConfidence() {
        return matchConfidence;
    }

    public String getTier() {
        return tier;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getAttemptLog() {
        return attemptLog;
    }

    public ReviewStatus getReviewStatus() {
        return reviewStatus;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public String getReviewNote() {
        return reviewNote;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }
}
