package cns.core.enrichment.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

class SupplierCircuitBreaker {

    private final String supplierId;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private boolean probeInFlight;
    private Instant lastFailureAt;
    private Instant openedAt;

    SupplierCircuitBreaker(String supplierId, Clock clock) {
        this.supplierId = supplierId;
        this.clock = clock;
    }

    synchronized boolean allow(CircuitBreakerSettings settings) {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (elapsedSinceOpen().compareTo(settings.timeout()) < 0) {
                    return false;
                }
                state = CircuitState.HALF_OPEN;
                consecutiveSuccesses = 0;
                probeInFlight = true;
                return true;
            case HALF_OPEN:
                if (probeInFlight) {
                    return false;
                }
                probeInFlight = true;
                return true;
            default:
                return false;
        }
    }

    synchronized CircuitState onSuccess(CircuitBreakerSettings settings) {
        switch (state) {
            case CLOSED:
                consecutiveFailures = 0;
                break;
            case HALF_OPEN:
                probeInFlight = false;
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= settings.successThreshold()) {
                    close();
                }
                break;
            case OPEN:
                // a call admitted before the breaker opened; it does not close it
                break;
            default:
                break;
        }
        return state;
    }

    synchronized CircuitState onFailure(CircuitBreakerSettings settings) {
        lastFailureAt = clock.instant();
        switch (state) {
            case CLOSED:
                consecutiveFailures++;
                if (consecutiveFailures >= settings.failureThreshold()) {
                    open();
                }
                break;
            case HALF_OPEN:
                consecutiveFailures++;
                open();
                break;
            case OPEN:
                consecutiveFailures++;
                break;
            default:
                break;
        }
        return state;
    }

    synchronized void onIgnored() {
        if (state == CircuitState.HALF_OPEN) {
            probeInFlight = false;
        }
    }

    synchronized boolean isOpen() {
        return state == CircuitState.OPEN;
    }

    synchronized void reset() {
        close();
        lastFailureAt = null;
    }

    synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(supplierId, state, consecutiveFailures, consecutiveSuccesses,
                lastFailureAt, openedAt);
    }

    private void open() {
        state = CircuitState.OPEN;
        openedAt = clock.instant();
        consecutiveSuccesses = 0;
        probeInFlight = false;
    }

    private void close() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        probeInFlight = false;
        openedAt = null;
    }

    private Duration elapsedSinceOpen() {
        if (openedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(openedAt, clock.instant());
    }
}
