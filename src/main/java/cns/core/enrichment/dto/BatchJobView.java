package cns.core.enrichment.dto;

import cns.core.enrichment.domain.BatchJob;
import cns.core.enrichment.domain.BatchJobStatus;
import java.time.Instant;
import java.util.UUID;

public record BatchJobView(UUID id,
                           String organizationId,
                           String label,
                           BatchJobStatus status,
                           int totalItems,
                           int processedItems,
                           int successfulItems,
                           int failedItems,
                           Instant createdAt,
                           Instant startedAt,
                           Instant completedAt) {
    public static BatchJobView from(BatchJob batch) {
        return new BatchJobView(batch.getId(), batch.getOrganizationId(), batch.getLabel(), batch.getStatus(),
                batch.getTotalItems(), batch.getProcessedItems(), batch.getSuccessfulItems(), batch.getFailedItems(),
                batch.getCreatedAt(), batch.getStartedAt(), batch.getCompletedAt());
    }
}
