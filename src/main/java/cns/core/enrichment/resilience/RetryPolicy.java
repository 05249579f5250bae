package cns.core.enrichment.resilience;

import java.time.Duration;
import java.util.function.DoubleSupplier;

public record RetryPolicy(
        boolean enabled,
        int maxAttempts,
        Duration initialDelay,
        double base,
        Duration maxDelay,
        boolean jitter) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        base = Math.max(1.0, base);
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(false, 1, Duration.ZERO, 1.0, Duration.ZERO, false);
    }

    public int effectiveAttempts() {
        return enabled ? maxAttempts : 1;
    }

    /**
     * Delay before the given retry (1 = the second attempt). Jitter is drawn uniformly
     * from {@code [0, delay]} and the sum never exceeds {@code maxDelay}.
     */
    public Duration delayBeforeRetry(int retryNumber, DoubleSupplier random) {
        long maxMs = maxDelay.toMillis();
        double raw = initialDelay.toMillis() * Math.pow(base, Math.max(0, retryNumber - 1));
        long delayMs = (long) Math.min(raw, maxMs);
        if (jitter && delayMs > 0) {
            delayMs = Math.min(maxMs, delayMs + (long) (random.getAsDouble() * delayMs));
        }
        return Duration.ofMillis(Math.max(0L, delayMs));
    }
}
