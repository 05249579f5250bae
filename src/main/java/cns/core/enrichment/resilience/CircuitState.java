package cns.core.enrichment.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
