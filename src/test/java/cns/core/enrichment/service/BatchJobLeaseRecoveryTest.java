package cns.core.enrichment.service;

import static org.assertj.core.api.Assertions.assertThat;

import cns.core.enrichment.MutableClock;
import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.BatchJob;
import cns.core.enrichment.domain.BatchJobStatus;
import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.EnrichmentStatus;
import cns.core.enrichment.domain.RequestSource;
import cns.core.enrichment.queue.JpaEnrichmentQueue;
import cns.core.enrichment.queue.NackResult;
import cns.core.enrichment.repository.EnrichmentRequestRepository;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaEnrichmentQueue.class, BatchJobService.class, BatchJobLeaseRecoveryTest.Config.class})
class BatchJobLeaseRecoveryTest {

    @TestConfiguration
    static class Config {

        @Bean
        MutableClock clock() {
            return MutableClock.startingAt("2024-05-01T10:00:00Z");
        }

        @Bean
        EnrichmentProperties enrichmentProperties() {
            return new EnrichmentProperties();
        }
    }

    @Autowired
    private JpaEnrichmentQueue queue;

    @Autowired
    private BatchJobService batchJobService;

    @Autowired
    private EnrichmentRequestRepository requestRepository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private EnrichmentProperties properties;

    @Test
    void recoveredAndReleasedRequestIsCountedOnceTowardsItsBatch() {
        BatchJob batch = batchJobService.create("org-1", "BOM rev C", RequestSource.BOM_UPLOAD, List.of(
                new BatchJobService.BatchItem("LM358", "TI", 8, "R1"),
                new BatchJobService.BatchItem("NE555", "TI", 2, "R2")));
        clock.advance(Duration.ofSeconds(1));

        EnrichmentRequest slowWorkerCopy = queue.lease(1).get(0);
        assertThat(slowWorkerCopy.getMpn()).isEqualTo("LM358");
        clock.advance(Duration.ofMillis(properties.getStuckThresholdMs() + 1));
        queue.recoverExpiredLeases();
        EnrichmentRequest secondWorkerCopy = queue.lease(1).get(0);
        assertThat(secondWorkerCopy.getId()).isEqualTo(slowWorkerCopy.getId());

        completeLikeAWorker(secondWorkerCopy);
        completeLikeAWorker(slowWorkerCopy);

        BatchJob running = batchJobService.get(batch.getId());
        assertThat(running.getProcessedItems()).isEqualTo(1);
        assertThat(running.getSuccessfulItems()).isEqualTo(1);
        assertThat(running.getStatus()).isNotIn(BatchJobStatus.COMPLETED, BatchJobStatus.COMPLETED_WITH_ERRORS);
        assertThat(requestRepository.findByBatchJobId(batch.getId()))
                .filteredOn(request -> request.getMpn().equals("NE555"))
                .singleElement()
                .satisfies(request -> assertThat(request.getStatus()).isEqualTo(EnrichmentStatus.PENDING));

        completeLikeAWorker(queue.lease(1).get(0));

        assertThat(batchJobService.get(batch.getId()).getStatus()).isEqualTo(BatchJobStatus.COMPLETED);
    }

    @Test
    void staleNackAfterRecoveryDoesNotFailTheBatchItem() {
        BatchJob batch = batchJobService.create("org-1", null, RequestSource.BOM_UPLOAD, List.of(
                new BatchJobService.BatchItem("LM358", "TI", 5, "R1")));
        properties.setRetryAttempts(0);
        try {
            EnrichmentRequest stale = queue.lease(1).get(0);
            clock.advance(Duration.ofMillis(properties.getStuckThresholdMs() + 1));
            assertThat(queue.recoverExpiredLeases().failed()).hasSize(1);
            batchJobService.recordChild(batch.getId(), false);

            assertThat(queue.nack(stale, "late supplier timeout")).isEqualTo(NackResult.IGNORED);

            BatchJob done = batchJobService.get(batch.getId());
            assertThat(done.getProcessedItems()).isEqualTo(1);
            assertThat(done.getFailedItems()).isEqualTo(1);
            assertThat(done.getStatus()).isEqualTo(BatchJobStatus.COMPLETED_WITH_ERRORS);
        } finally {
            properties.setRetryAttempts(3);
        }
    }

    private void completeLikeAWorker(EnrichmentRequest leased) {
        if (queue.ack(leased, 92.0, "catalog", false)) {
            batchJobService.recordChild(leased.getBatchJobId(), true);
        }
    }
}
