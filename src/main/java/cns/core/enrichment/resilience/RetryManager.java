package cns.core.enrichment.resilience;

import cns.core.enrichment.exception.PermanentSupplierException;
import cns.core.enrichment.exception.SupplierException;
import cns.core.enrichment.exception.TransientSupplierException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);
    private final CircuitBreakerRegistry breakers;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    @Autowired
    public RetryManager(CircuitBreakerRegistry breakers) {
        this(breakers, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryManager(CircuitBreakerRegistry breakers, Sleeper sleeper, DoubleSupplier random) {
        this.breakers = breakers;
        this.sleeper = sleeper;
        this.random = random;
    }

    public <T> RetryResult<T> execute(String supplierId,
                                      SupplierCall<T> call,
                                      RetryPolicy policy,
                                      CircuitBreakerSettings breakerSettings) {
        int maxAttempts = policy.effectiveAttempts();
        SupplierException lastException = null;
        long backoffMs = 0L;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T value = call.call();
                breakers.onSuccess(supplierId, breakerSettings);
                return RetryResult.success(value, attempt, backoffMs, lastException);
            } catch (PermanentSupplierException ex) {
                breakers.onIgnored(supplierId, breakerSettings);
                return RetryResult.failure(ex, attempt, backoffMs, false);
            } catch (TransientSupplierException ex) {
                lastException = ex;
            } catch (RuntimeException ex) {
                lastException = new TransientSupplierException(supplierId, "Unexpected error: " + ex.getMessage(), ex);
            }

            breakers.onFailure(supplierId, breakerSettings);
            if (attempt == maxAttempts) {
                break;
            }
            if (breakerSettings.enabled() && breakers.isOpen(supplierId)) {
                log.warn("Retry abandoned supplier={} attempt={} reason=circuit-open", supplierId, attempt);
                return RetryResult.failure(lastException, attempt, backoffMs, true);
            }
            Duration delay = policy.delayBeforeRetry(attempt, random);
            log.warn("Retryable error supplier={} attempt={} delayMs={} message={}",
                    supplierId, attempt, delay.toMillis(), lastException.getMessage());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryResult.failure(lastException, attempt, backoffMs, true);
            }
            backoffMs += delay.toMillis();
        }
        return RetryResult.failure(lastException, maxAttempts, backoffMs, false);
    }
}
