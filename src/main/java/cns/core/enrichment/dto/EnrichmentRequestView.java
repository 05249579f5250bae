package cns.core.enrichment.dto;

import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.EnrichmentStatus;
import cns.core.enrichment.domain.RequestSource;
import java.time.Instant;
import java.util.UUID;

public record EnrichmentRequestView(UUID id,
                                    String mpn,
                                    String manufacturer,
                                    int priority,
                                    RequestSource source,
                                    String organizationId,
                                    UUID batchJobId,
                                    String lineReference,
                                    EnrichmentStatus status,
                                    int attemptCount,
                                    Instant createdAt,
                                    Instant lastAttemptAt,
                                    Instant completedAt,
                                    Instant nextAttemptAt,
                                    Double qualityScore,
                                    String tier,
                                    boolean needsReview,
                                    String errorMessage) {
    public static EnrichmentRequestView from(EnrichmentRequest request) {
        return new EnrichmentRequestView(request.getId(), request.getMpn(), request.getManufacturer(),
                request.getPriority(), request.getSource(), request.getOrganizationId(), request.getBatchJobId(),
                request.getLineReference(), request.getStatus(), request.getAttemptCount(), request.getCreatedAt(),
                request.getLastAttemptAt(), request.getCompletedAt(), request.getNextAttemptAt(),
                request.getQualityScore(), request.getTier(), request.isNeedsReview(), request.getErrorMessage());
    }
}
