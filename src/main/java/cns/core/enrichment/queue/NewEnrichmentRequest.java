package cns.core.enrichment.queue;

import cns.core.enrichment.domain.RequestSource;
import java.util.UUID;

public record NewEnrichmentRequest(
        String mpn,
        String manufacturer,
        int priority,
        RequestSource source,
        String organizationId,
        UUID batchJobId,
        String lineReference) {
}
