package cns.core.enrichment.service;

import cns.core.enrichment.resilience.CircuitBreakerSnapshot;
import java.util.List;
import java.util.Map;

public record EnrichmentReport(
        long pending,
        long processing,
        long retryScheduled,
        long succeeded,
        long failed,
        long cancelled,
        long totalProcessed,
        long totalSuccess,
        long totalNeedsReview,
        long totalErrors,
        long totalRetryScheduled,
        long totalConflicts,
        long totalLeasesRecovered,
        long avgProcessingMs,
        double jobsPerMinute,
        long catalogRecords,
        long cacheEntries,
        Map<String, Long> auditOutcomes,
        Map<String, LatencyStats> supplierLatency,
        List<CircuitBreakerSnapshot> circuitBreakers) {
}
