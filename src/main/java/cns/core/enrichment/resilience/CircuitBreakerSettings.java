package cns.core.enrichment.resilience;

import java.time.Duration;

public record CircuitBreakerSettings(
        boolean enabled,
        int failureThreshold,
        Duration timeout,
        int successThreshold) {

    public CircuitBreakerSettings {
        failureThreshold = Math.max(1, failureThreshold);
        successThreshold = Math.max(1, successThreshold);
        if (timeout == null || timeout.isNegative()) {
            timeout = Duration.ZERO;
        }
    }

    public static CircuitBreakerSettings disabled() {
        return new CircuitBreakerSettings(false, 1, Duration.ZERO, 1);
    }
}
