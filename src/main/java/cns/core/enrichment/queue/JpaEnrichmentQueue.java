package cns.core.enrichment.queue;

import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.EnrichmentStatus;
import cns.core.enrichment.repository.EnrichmentRequestRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

@Component
public class JpaEnrichmentQueue implements EnrichmentQueue {

    private static final Logger log = LoggerFactory.getLogger(JpaEnrichmentQueue.class);
    private static final Set<EnrichmentStatus> CANCELLABLE =
            EnumSet.of(EnrichmentStatus.PENDING, EnrichmentStatus.RETRY_SCHEDULED, EnrichmentStatus.PROCESSING);

    private final EnrichmentRequestRepository repository;
    private final EnrichmentProperties properties;
    private final Clock clock;

    public JpaEnrichmentQueue(EnrichmentRequestRepository repository, EnrichmentProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public EnrichmentRequest enqueue(NewEnrichmentRequest request) {
        EnrichmentRequest entity = new EnrichmentRequest(UUID.randomUUID(), request.mpn(), request.manufacturer(),
                request.priority(), request.source(), request.organizationId(), request.batchJobId(),
                request.lineReference());
        entity.setCreatedAt(clock.instant());
        EnrichmentRequest saved = repository.save(entity);
        log.info("Enqueued requestId={} mpn={} priority={} batchJobId={}",
                saved.getId(), saved.getMpn(), saved.getPriority(), saved.getBatchJobId());
        return saved;
    }

    @Override
    public List<EnrichmentRequest> lease(int maxItems) {
        if (maxItems <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<EnrichmentRequest> candidates = repository.findClaimable(
                EnrichmentStatus.PENDING,
                EnrichmentStatus.RETRY_SCHEDULED,
                now,
                PageRequest.of(0, maxItems));
        List<EnrichmentRequest> leased = new ArrayList<>();
        for (EnrichmentRequest candidate : candidates) {
            int updated = repository.claim(candidate.getId(), EnrichmentStatus.PROCESSING, now,
                    EnrichmentStatus.CLAIMABLE);
            if (updated == 1) {
                repository.findById(candidate.getId()).ifPresent(leased::add);
            }
        }
        return leased;
    }

    @Override
    public boolean ack(EnrichmentRequest leased, double qualityScore, String tier, boolean needsReview) {
        int updated = repository.markSucceeded(leased.getId(), leased.getAttemptCount(), EnrichmentStatus.SUCCEEDED,
                EnrichmentStatus.PROCESSING, clock.instant(), qualityScore, tier, needsReview);
        if (updated == 0) {
            log.warn("Ack ignored, lease no longer held requestId={} attempt={}", leased.getId(), leased.getAttemptCount());
        }
        return updated == 1;
    }

    @Override
    public NackResult nack(EnrichmentRequest leased, String errorMessage) {
        UUID requestId = leased.getId();
        Instant now = clock.instant();
        int attempts = leased.getAttemptCount();
        if (attempts > properties.getRetryAttempts()) {
            if (repository.markFailed(requestId, attempts, EnrichmentStatus.FAILED, EnrichmentStatus.PROCESSING, now,
                    errorMessage) == 0) {
                return NackResult.IGNORED;
            }
            log.warn("Request failed requestId={} attempts={} message={}", requestId, attempts, errorMessage);
            return NackResult.FAILED;
        }
        Instant nextAttemptAt = now.plus(retryDelay(attempts));
        if (repository.scheduleRetry(requestId, attempts, EnrichmentStatus.RETRY_SCHEDULED, EnrichmentStatus.PROCESSING,
                nextAttemptAt, errorMessage) == 0) {
            return NackResult.IGNORED;
        }
        log.info("Request re-queued requestId={} attempt={} nextAttemptAt={}", requestId, attempts, nextAttemptAt);
        return NackResult.RETRY_SCHEDULED;
    }

    @Override
    public boolean release(EnrichmentRequest leased) {
        boolean released = repository.release(leased.getId(), leased.getAttemptCount(), EnrichmentStatus.PENDING,
                EnrichmentStatus.PROCESSING) == 1;
        if (released) {
            log.info("Lease released requestId={} attempt={}", leased.getId(), leased.getAttemptCount());
        }
        return released;
    }

    @Override
    public boolean cancel(UUID requestId) {
        return repository.markCancelled(requestId, EnrichmentStatus.CANCELLED, clock.instant(), CANCELLABLE) == 1;
    }

    @Override
    public int cancelQueued(UUID batchJobId) {
        return repository.cancelQueuedForBatch(batchJobId, EnrichmentStatus.CANCELLED, clock.instant(),
                EnrichmentStatus.CLAIMABLE);
    }

    @Override
    public RecoveredLeases recoverExpiredLeases() {
        Instant now = clock.instant();
        Instant cutoff = now.minusMillis(properties.getStuckThresholdMs());
        int maxAttempts = properties.getRetryAttempts() + 1;
        List<EnrichmentRequest> exhausted = repository.findStuckExhausted(EnrichmentStatus.PROCESSING, cutoff,
                maxAttempts);
        List<EnrichmentRequest> failed = new ArrayList<>();
        for (EnrichmentRequest request : exhausted) {
            int updated = repository.markFailed(request.getId(), request.getAttemptCount(), EnrichmentStatus.FAILED,
                    EnrichmentStatus.PROCESSING, now, "Lease expired after final attempt");
            if (updated == 1) {
                failed.add(request);
            }
        }
        int requeued = repository.recoverStuck(
                EnrichmentStatus.PROCESSING,
                EnrichmentStatus.RETRY_SCHEDULED,
                cutoff,
                now,
                "Lease expired, re-queued");
        if (requeued > 0 || !failed.isEmpty()) {
            log.warn("Recovered expired leases requeued={} failed={}", requeued, failed.size());
        }
        return new RecoveredLeases(requeued, failed);
    }

    Duration retryDelay(int attempt) {
        long seconds = properties.getRetryDelaySeconds() * (1L << Math.min(Math.max(attempt - 1, 0), 10));
        return Duration.ofSeconds(seconds);
    }
}
