package cns.core.enrichment.policy;

import cns.core.enrichment.quality.ScoringWeights;
import cns.core.enrichment.resilience.CircuitBreakerSettings;
import cns.core.enrichment.resilience.RetryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Set;

public record EnrichmentPolicy(
        String organizationId,
        double catalogThreshold,
        double cacheThreshold,
        Duration cacheTtl,
        boolean catalogEnabled,
        boolean cacheEnabled,
        List<String> supplierPriority,
        Set<String> disabledSuppliers,
        double minMatchConfidence,
        CircuitBreakerSettings circuitBreaker,
        RetryPolicy retry,
        ScoringWeights scoring) {

    public EnrichmentPolicy {
        if (cacheThreshold > catalogThreshold) {
            throw new IllegalArgumentException("cache threshold " + cacheThreshold
                    + " must not exceed catalog threshold " + catalogThreshold);
        }
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive");
        }
        supplierPriority = List.copyOf(supplierPriority);
        disabledSuppliers = Set.copyOf(disabledSuppliers);
    }

    public boolean supplierEnabled(String supplierId) {
        return !disabledSuppliers.contains(supplierId);
    }
}
