package cns.core.enrichment.service;

import cns.core.enrichment.audit.SupplierAttempt;
import cns.core.enrichment.policy.EnrichmentPolicy;
import cns.core.enrichment.quality.MatchConfidenceCalculator;
import cns.core.enrichment.resilience.CircuitBreakerRegistry;
import cns.core.enrichment.resilience.RetryManager;
import cns.core.enrichment.resilience.RetryResult;
import cns.core.enrichment.supplier.SupplierAdapter;
import cns.core.enrichment.supplier.SupplierLookup;
import cns.core.enrichment.supplier.SupplierRateLimiter;
import cns.core.enrichment.supplier.SupplierRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SupplierDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SupplierDispatcher.class);
    private final SupplierRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final RetryManager retryManager;
    private final SupplierRateLimiter rateLimiter;
    private final MatchConfidenceCalculator matchCalculator;
    private final SupplierLatencyRecorder latencyRecorder;

    public SupplierDispatcher(SupplierRegistry registry,
                              CircuitBreakerRegistry breakers,
                              RetryManager retryManager,
                              SupplierRateLimiter rateLimiter,
                              MatchConfidenceCalculator matchCalculator,
                              SupplierLatencyRecorder latencyRecorder) {
        this.registry = registry;
        this.breakers = breakers;
        this.retryManager = retryManager;
        this.rateLimiter = rateLimiter;
        this.matchCalculator = matchCalculator;
        this.latencyRecorder = latencyRecorder;
    }

    public DispatchResult dispatch(String mpn, String manufacturer, EnrichmentPolicy policy) {
        List<SupplierAttempt> attempts = new ArrayList<>();
        List<SupplierLookup> responses = new ArrayList<>();
        for (SupplierAdapter adapter : registry.ordered(policy)) {
            String supplierId = adapter.id();
            if (!breakers.allow(supplierId, policy.circuitBreaker())) {
                log.info("Supplier skipped supplier={} mpn={} reason=circuit-open", supplierId, mpn);
                attempts.add(SupplierAttempt.skipped(supplierId, SupplierAttempt.Result.SKIPPED_CIRCUIT_OPEN));
                continue;
            }
            if (!rateLimiter.tryAcquire(supplierId, adapter.maxRequestsPerHour())) {
                breakers.onIgnored(supplierId, policy.circuitBreaker());
                log.info("Supplier skipped supplier={} mpn={} reason=quota", supplierId, mpn);
                attempts.add(SupplierAttempt.skipped(supplierId, SupplierAttempt.Result.SKIPPED_QUOTA));
                continue;
            }

            long startedNs = System.nanoTime();
            RetryResult<SupplierLookup> result = retryManager.execute(supplierId,
                    () -> adapter.lookup(mpn, manufacturer), policy.retry(), policy.circuitBreaker());
            latencyRecorder.record(supplierId, System.nanoTime() - startedNs);

            if (!result.succeeded()) {
                SupplierAttempt.Result outcome = result.abandoned()
                        ? SupplierAttempt.Result.ABANDONED
                        : SupplierAttempt.Result.FAILED;
                String error = result.failure() == null ? null : result.failure().getMessage();
                log.warn("Supplier failed supplier={} mpn={} attempts={} message={}",
                        supplierId, mpn, result.attempts(), error);
                attempts.add(new SupplierAttempt(supplierId, outcome, result.attempts(), result.backoffMs(), error));
                continue;
            }

            SupplierLookup lookup = result.value();
            responses.add(lookup);
            String recovered = result.recoveredFrom() == null
                    ? null
                    : "recovered after: " + result.recoveredFrom().getMessage();
            if (!lookup.hasPayload()) {
                attempts.add(new SupplierAttempt(supplierId, SupplierAttempt.Result.NOT_FOUND,
                        result.attempts(), result.backoffMs(), recovered));
                continue;
            }
            double match = matchCalculator.matchConfidence(mpn, manufacturer,
                    lookup.returnedMpn(), lookup.returnedManufacturer());
            if (match < policy.minMatchConfidence()) {
                attempts.add(new SupplierAttempt(supplierId, SupplierAttempt.Result.NO_MATCH,
                        result.attempts(), result.backoffMs(),
                        String.format("match confidence %.2f below %.2f", match, policy.minMatchConfidence())));
                continue;
            }
            attempts.add(new SupplierAttempt(supplierId, SupplierAttempt.Result.FOUND,
                    result.attempts(), result.backoffMs(), recovered));
            log.info("Supplier matched supplier={} mpn={} match={}", supplierId, mpn, match);
            return new DispatchResult(lookup, match, attempts, responses);
        }
        return new DispatchResult(null, 0.0, attempts, responses);
    }
}
