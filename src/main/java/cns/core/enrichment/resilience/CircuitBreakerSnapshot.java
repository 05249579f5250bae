package cns.core.enrichment.resilience;

import java.time.Instant;

public record CircuitBreakerSnapshot(
        String supplierId,
        CircuitState state,
        int failureCount,
        int successCount,
        Instant lastFailureAt,
        Instant openedAt) {
}
