package cns.core.enrichment.resilience;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);
    private final Map<String, SupplierCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = clock;
    }

    public boolean allow(String supplierId, CircuitBreakerSettings settings) {
        if (!settings.enabled()) {
            return true;
        }
        return breaker(supplierId).allow(settings);
    }

    public void onSuccess(String supplierId, CircuitBreakerSettings settings) {
        if (!settings.enabled()) {
            return;
        }
        SupplierCircuitBreaker breaker = breaker(supplierId);
        boolean wasHalfOpen = breaker.snapshot().state() == CircuitState.HALF_OPEN;
        CircuitState state = breaker.onSuccess(settings);
        if (wasHalfOpen && state == CircuitState.CLOSED) {
            log.info("Circuit closed supplier={}", supplierId);
        }
    }

    public void onFailure(String supplierId, CircuitBreakerSettings settings) {
        if (!settings.enabled()) {
            return;
        }
        SupplierCircuitBreaker breaker = breaker(supplierId);
        boolean wasOpen = breaker.isOpen();
        CircuitState state = breaker.onFailure(settings);
        if (!wasOpen && state == CircuitState.OPEN) {
            log.warn("Circuit opened supplier={} failureThreshold={} timeout={}",
                    supplierId, settings.failureThreshold(), settings.timeout());
        }
    }

    public void onIgnored(String supplierId, CircuitBreakerSettings settings) {
        if (!settings.enabled()) {
            return;
        }
        breaker(supplierId).onIgnored();
    }

    public boolean isOpen(String supplierId) {
        SupplierCircuitBreaker breaker = breakers.get(supplierId);
        return breaker != null && breaker.isOpen();
    }

    public void reset(String supplierId) {
        SupplierCircuitBreaker breaker = breakers.get(supplierId);
        if (breaker != null) {
            breaker.reset();
            log.info("Circuit reset supplier={}", supplierId);
        }
    }

    public CircuitBreakerSnapshot snapshot(String supplierId) {
        return breaker(supplierId).snapshot();
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(SupplierCircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::supplierId))
                .toList();
    }

    private SupplierCircuitBreaker breaker(String supplierId) {
        return breakers.computeIfAbsent(supplierId, id -> new SupplierCircuitBreaker(id, clock));
    }
}
