package cns.core.enrichment.queue;

import cns.core.enrichment.domain.EnrichmentRequest;
import java.util.List;
import java.util.UUID;

public interface EnrichmentQueue {

    EnrichmentRequest enqueue(NewEnrichmentRequest request);

    List<EnrichmentRequest> lease(int maxItems);

    /**
     * Completes a leased request. Returns {@code false} when the lease was lost in the meantime,
     * either recovered as expired or claimed again under a newer attempt.
     */
    boolean ack(EnrichmentRequest leased, double qualityScore, String tier, boolean needsReview);

    /**
     * Failed attempt. Re-queued with exponential delay at the same priority until the
     * job-level attempt ceiling is reached, then terminal. {@link NackResult#IGNORED} when the
     * lease is no longer held.
     */
    NackResult nack(EnrichmentRequest leased, String errorMessage);

    /**
     * Hands a lease back untouched: the request is pending again and the attempt is not charged.
     */
    boolean release(EnrichmentRequest leased);

    boolean cancel(UUID requestId);

    int cancelQueued(UUID batchJobId);

    RecoveredLeases recoverExpiredLeases();

    record RecoveredLeases(int requeued, List<EnrichmentRequest> failed) {
    }
}
