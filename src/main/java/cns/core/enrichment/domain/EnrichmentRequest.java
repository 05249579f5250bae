package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "enrichment_request", indexes = {
        @Index(name = "idx_enrichment_request_dispatch", columnList = "status, priority, created_at"),
        @Index(name = "idx_enrichment_request_batch", columnList = "batch_job_id")
})
public class EnrichmentRequest {

    @Id
    private UUID id;

    @Column(nullable = false, length = 128)
    private String mpn;

    @Column(length = 255)
    private String manufacturer;

    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_tag", nullable = false, length = 32)
    private RequestSource source;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(name = "batch_job_id")
    private UUID batchJobId;

    @Column(name = "line_reference", length = 128)
    private String lineReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private EnrichmentStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Column(name = "tier", length = 16)
    private String tier;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Lob
    @Column(name = "error_message")
    private String errorMessage;

    protected EnrichmentRequest() {
    }

    public EnrichmentRequest(UUID id, String mpn, String manufacturer, int priority, RequestSource source,
                             String organizationId, UUID batchJobId, String lineReference) {
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be between 1 and 10, was " + priority);
        }
        this.id = id;
        this.mpn = mpn;
        this.manufacturer = manufacturer;
        this.priority = priority;
        this.source = source;
        this.organizationId = organizationId;
        this.batchJobId = batchJobId;
        this.lineReference = lineReference;
        this.status = EnrichmentStatus.PENDING;
        this.attemptCount = 0;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public String getMpn() {
        return mpn;
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public int getPriority() {
        return priority;
    }

    public RequestSource getSource() {
        return source;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public UUID getBatchJobId() {
        return batchJobId;
    }

    public String getLineReference() {
        return lineReference;
    }

    public EnrichmentStatus getStatus() {
        return status;
    }

    public void setStatus(EnrichmentStatus status) {
        this.status = status;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    public String getTier() {
        return tier;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
