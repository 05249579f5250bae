package cns.core.enrichment.service;

import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.queue.EnrichmentQueue;
import java.util.List;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class EnrichmentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentDispatchService.class);
    private final EnrichmentQueue queue;
    private final EnrichmentJobProcessor processor;
    private final EnrichmentProperties properties;
    private final TaskExecutor executor;
    private final Semaphore semaphore;

    public EnrichmentDispatchService(EnrichmentQueue queue,
                                     EnrichmentJobProcessor processor,
                                     EnrichmentProperties properties,
                                     @Qualifier("enrichmentExecutor") TaskExecutor executor,
                                     Semaphore semaphore) {
        this.queue = queue;
        this.processor = processor;
        this.properties = properties;
        this.executor = executor;
        this.semaphore = semaphore;
    }

    @Scheduled(fixedDelayString = "${cns.enrichment.scheduler-fixed-delay-ms:5000}")
    public void scheduledDispatch() {
        log.debug("Scheduled dispatch tick");
        dispatchPending();
    }

    public DispatchSummary dispatchPending() {
        int recovered = processor.recoverExpiredLeases();
        int capacity = Math.min(properties.getBatchSize(), semaphore.availablePermits());
        List<EnrichmentRequest> leased = queue.lease(capacity);
        int submitted = 0;
        for (EnrichmentRequest request : leased) {
            try {
                executor.execute(() -> processor.process(request));
                submitted++;
            } catch (TaskRejectedException ex) {
                log.warn("Worker pool rejected requestId={} message={}", request.getId(), ex.getMessage());
                queue.release(request);
            }
        }
        if (submitted > 0 || recovered > 0) {
            log.info("Dispatch completed claimed={} leasesRecovered={}", submitted, recovered);
        }
        return new DispatchSummary(submitted, recovered);
    }
}
