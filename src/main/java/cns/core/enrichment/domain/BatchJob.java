package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "batch_job")
public class BatchJob {

    @Id
    private UUID id;

    @Column(name = "organization_id", nullable = false, length = 64)
    private String organizationId;

    @Column(length = 255)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private BatchJobStatus status;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "processed_items", nullable = false)
    private int processedItems;

    @Column(name = "successful_items", nullable = false)
    private int successfulItems;

    @Column(name = "failed_items", nullable = false)
    private int failedItems;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected BatchJob() {
    }

    public BatchJob(UUID id, String organizationId, String label, int totalItems) {
        this.id = id;
        this.organizationId = organizationId;
        this.label = label;
        this.totalItems = totalItems;
        this.status = BatchJobStatus.PENDING;
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

    public String getOrganizationId() {
        return organizationId;
    }

    public String getLabel() {
        return label;
    }

    public BatchJobStatus getStatus() {
        return status;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public int getProcessedItems() {
        return processedItems;
    }

    public int getSuccessfulItems() {
        return successfulItems;
    }

    public int getFailedItems() {
        return failedItems;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
