package cns.core.enrichment.domain;

import java.util.EnumSet;
import java.util.Set;

public enum EnrichmentStatus {
    PENDING,
    PROCESSING,
    RETRY_SCHEDULED,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public static final Set<EnrichmentStatus> CLAIMABLE = EnumSet.of(PENDING, RETRY_SCHEDULED);
    public static final Set<EnrichmentStatus> TERMINAL = EnumSet.of(SUCCEEDED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
