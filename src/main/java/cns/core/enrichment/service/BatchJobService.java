package cns.core.enrichment.service;

import cns.core.enrichment.domain.BatchJob;
import cns.core.enrichment.domain.BatchJobStatus;
import cns.core.enrichment.domain.RequestSource;
import cns.core.enrichment.exception.ResourceNotFoundException;
import cns.core.enrichment.queue.EnrichmentQueue;
import cns.core.enrichment.queue.NewEnrichmentRequest;
import cns.core.enrichment.repository.BatchJobRepository;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BatchJobService {

    private static final Logger log = LoggerFactory.getLogger(BatchJobService.class);
    private static final Set<BatchJobStatus> OPEN = EnumSet.of(BatchJobStatus.PENDING, BatchJobStatus.RUNNING);

    private final BatchJobRepository repository;
    private final EnrichmentQueue queue;
    private final Clock clock;

    public BatchJobService(BatchJobRepository repository, EnrichmentQueue queue, Clock clock) {
        this.repository = repository;
        this.queue = queue;
        this.clock = clock;
    }

    @Transactional
    public BatchJob create(String organizationId, String label, RequestSource source, List<BatchItem> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one item");
        }
        BatchJob batch = repository.save(new BatchJob(UUID.randomUUID(), organizationId, label, items.size()));
        for (BatchItem item : items) {
            queue.enqueue(new NewEnrichmentRequest(item.mpn(), item.manufacturer(), item.priority(), source,
                    organizationId, batch.getId(), item.lineReference()));
        }
        log.info("Batch created batchJobId={} organizationId={} items={}", batch.getId(), organizationId, items.size());
        return batch;
    }

    public BatchJob get(UUID batchJobId) {
        return repository.findById(batchJobId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch job not found: " + batchJobId));
    }

    public boolean isCancelled(UUID batchJobId) {
        return repository.findById(batchJobId)
                .map(batch -> batch.getStatus() == BatchJobStatus.CANCELLED)
                .orElse(false);
    }

    public BatchJob cancel(UUID batchJobId) {
        BatchJob batch = get(batchJobId);
        if (repository.cancel(batchJobId, BatchJobStatus.CANCELLED, OPEN, clock.instant()) == 1) {
            int cancelled = queue.cancelQueued(batchJobId);
            log.info("Batch cancelled batchJobId={} queuedCancelled={}", batchJobId, cancelled);
        }
        return repository.findById(batchJobId).orElse(batch);
    }

    public void markRunning(UUID batchJobId) {
        if (batchJobId == null) {
            return;
        }
        repository.markRunning(batchJobId, BatchJobStatus.PENDING, BatchJobStatus.RUNNING, clock.instant());
    }

    public void recordChild(UUID batchJobId, boolean success) {
        if (batchJobId == null) {
            return;
        }
        repository.recordItem(batchJobId, success ? 1 : 0, success ? 0 : 1);
        if (repository.completeClean(batchJobId, BatchJobStatus.COMPLETED, OPEN, clock.instant()) == 1) {
            log.info("Batch completed batchJobId={}", batchJobId);
        } else if (repository.completeWithErrors(batchJobId, BatchJobStatus.COMPLETED_WITH_ERRORS, OPEN,
                clock.instant()) == 1) {
            log.info("Batch completed with errors batchJobId={}", batchJobId);
        }
    }

    public record BatchItem(String mpn, String manufacturer, int priority, String lineReference) {
    }
}
