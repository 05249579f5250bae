package cns.core.enrichment.queue;

import static org.assertj.core.api.Assertions.assertThat;

import cns.core.enrichment.MutableClock;
import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.EnrichmentStatus;
import cns.core.enrichment.domain.RequestSource;
import cns.core.enrichment.repository.EnrichmentRequestRepository;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaEnrichmentQueue.class, JpaEnrichmentQueueTest.Config.class})
class JpaEnrichmentQueueTest {

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
    private EnrichmentRequestRepository repository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private EnrichmentProperties properties;

    @Test
    void leasesHighestPriorityFirstThenOldest() {
        EnrichmentRequest first = enqueue("LM358", 3);
        EnrichmentRequest urgent = enqueue("NE555", 8);
        EnrichmentRequest second = enqueue("TL072", 3);

        List<EnrichmentRequest> leased = queue.lease(10);

        assertThat(leased).extracting(EnrichmentRequest::getId)
                .containsExactly(urgent.getId(), first.getId(), second.getId());
        assertThat(leased).allSatisfy(request -> {
            assertThat(request.getStatus()).isEqualTo(EnrichmentStatus.PROCESSING);
            assertThat(request.getAttemptCount()).isEqualTo(1);
            assertThat(request.getStartedAt()).isEqualTo(clock.instant());
        });
    }

    @Test
    void leasedRequestIsNotHandedOutTwice() {
        enqueue("LM358", 5);

        assertThat(queue.lease(10)).hasSize(1);
        assertThat(queue.lease(10)).isEmpty();
    }

    @Test
    void leaseHonoursBatchLimit() {
        enqueue("LM358", 5);
        enqueue("NE555", 5);
        enqueue("TL072", 5);

        assertThat(queue.lease(2)).hasSize(2);
        assertThat(queue.lease(0)).isEmpty();
    }

    @Test
    void nackSchedulesRetryWithExponentialDelay() {
        EnrichmentRequest request = enqueue("LM358", 5);
        EnrichmentRequest leased = queue.lease(1).get(0);

        assertThat(queue.nack(leased, "supplier timeout")).isEqualTo(NackResult.RETRY_SCHEDULED);

        EnrichmentRequest retrying = repository.findById(request.getId()).orElseThrow();
        assertThat(retrying.getStatus()).isEqualTo(EnrichmentStatus.RETRY_SCHEDULED);
        assertThat(retrying.getNextAttemptAt()).isEqualTo(clock.instant().plusSeconds(30));
        assertThat(retrying.getErrorMessage()).isEqualTo("supplier timeout");
        assertThat(retrying.getPriority()).isEqualTo(5);
        assertThat(queue.lease(1)).isEmpty();

        clock.advance(Duration.ofSeconds(30));
        List<EnrichmentRequest> releasedAfterDelay = queue.lease(1);
        assertThat(releasedAfterDelay).singleElement().satisfies(r -> assertThat(r.getAttemptCount()).isEqualTo(2));
    }

    @Test
    void nackFailsRequestOnceAttemptsAreExhausted() {
        EnrichmentRequest request = enqueue("LM358", 5);
        for (int attempt = 1; attempt <= properties.getRetryAttempts(); attempt++) {
            EnrichmentRequest leased = queue.lease(1).get(0);
            assertThat(queue.nack(leased, "attempt " + attempt)).isEqualTo(NackResult.RETRY_SCHEDULED);
            clock.advance(Duration.ofHours(1));
        }
        EnrichmentRequest last = queue.lease(1).get(0);

        assertThat(queue.nack(last, "final")).isEqualTo(NackResult.FAILED);

        EnrichmentRequest failed = repository.findById(request.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(EnrichmentStatus.FAILED);
        assertThat(failed.getAttemptCount()).isEqualTo(properties.getRetryAttempts() + 1);
        assertThat(failed.getCompletedAt()).isNotNull();
    }

    @Test
    void nackOfRequestNotInFlightIsIgnored() {
        EnrichmentRequest request = enqueue("LM358", 5);

        assertThat(queue.nack(request, "late")).isEqualTo(NackResult.IGNORED);
        EnrichmentRequest unknown = new EnrichmentRequest(UUID.randomUUID(), "NE555", "TI", 5, RequestSource.MANUAL,
                "org-1", null, null);
        assertThat(queue.nack(unknown, "unknown")).isEqualTo(NackResult.IGNORED);
        assertThat(repository.findById(request.getId()).orElseThrow().getStatus()).isEqualTo(EnrichmentStatus.PENDING);
    }

    @Test
    void ackRecordsOutcome() {
        EnrichmentRequest request = enqueue("LM358", 5);
        EnrichmentRequest leased = queue.lease(1).get(0);

        assertThat(queue.ack(leased, 96.5, "catalog", false)).isTrue();

        EnrichmentRequest done = repository.findById(request.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(EnrichmentStatus.SUCCEEDED);
        assertThat(done.getQualityScore()).isEqualTo(96.5);
        assertThat(done.getTier()).isEqualTo("catalog");
        assertThat(done.isNeedsReview()).isFalse();
    }

    @Test
    void expiredLeaseIsRequeuedAndImmediatelyClaimable() {
        EnrichmentRequest request = enqueue("LM358", 5);
        queue.lease(1);
        clock.advance(Duration.ofMillis(properties.getStuckThresholdMs() + 1));

        EnrichmentQueue.RecoveredLeases recovered = queue.recoverExpiredLeases();

        assertThat(recovered.requeued()).isEqualTo(1);
        assertThat(recovered.failed()).isEmpty();
        assertThat(repository.findById(request.getId()).orElseThrow().getStatus())
                .isEqualTo(EnrichmentStatus.RETRY_SCHEDULED);
        assertThat(queue.lease(1)).singleElement().satisfies(r -> assertThat(r.getAttemptCount()).isEqualTo(2));
    }

    @Test
    void workerWhoseLeaseWasRecoveredCannotCompleteOrFailTheRequest() {
        EnrichmentRequest request = enqueue("LM358", 5);
        EnrichmentRequest stale = queue.lease(1).get(0);
        clock.advance(Duration.ofMillis(properties.getStuckThresholdMs() + 1));
        queue.recoverExpiredLeases();
        EnrichmentRequest current = queue.lease(1).get(0);

        assertThat(queue.ack(stale, 90.0, "catalog", false)).isFalse();
        assertThat(queue.nack(stale, "late timeout")).isEqualTo(NackResult.IGNORED);
        EnrichmentRequest inFlight = repository.findById(request.getId()).orElseThrow();
        assertThat(inFlight.getStatus()).isEqualTo(EnrichmentStatus.PROCESSING);
        assertThat(inFlight.getAttemptCount()).isEqualTo(2);

        assertThat(queue.ack(current, 91.0, "catalog", false)).isTrue();
        assertThat(queue.ack(current, 91.0, "catalog", false)).isFalse();
        assertThat(repository.findById(request.getId()).orElseThrow().getQualityScore()).isEqualTo(91.0);
    }

    @Test
    void ackAfterLeaseRecoveryIsRejected() {
        enqueue("LM358", 5);
        EnrichmentRequest stale = queue.lease(1).get(0);
        clock.advance(Duration.ofMillis(properties.getStuckThresholdMs() + 1));
        queue.recoverExpiredLeases();

        assertThat(queue.ack(stale, 90.0, "catalog", false)).isFalse();
        assertThat(repository.findById(stale.getId()).orElseThrow().getStatus())
                .isEqualTo(EnrichmentStatus.RETRY_SCHEDULED);
    }

    @Test
    void releaseReturnsLeaseWithoutChargingAnAttempt() {
        EnrichmentRequest request = enqueue("LM358", 5);
        EnrichmentRequest leased = queue.lease(1).get(0);

        assertThat(queue.release(leased)).isTrue();

        EnrichmentRequest released = repository.findById(request.getId()).orElseThrow();
        assertThat(released.getStatus()).isEqualTo(EnrichmentStatus.PENDING);
        assertThat(released.getAttemptCount()).isZero();
        assertThat(released.getStartedAt()).isNull();
        assertThat(queue.release(leased)).isFalse();
        assertThat(queue.lease(1)).singleElement().satisfies(r -> assertThat(r.getAttemptCount()).isEqualTo(1));
    }

    @Test
    void releaseOnFinalAttemptKeepsRequestAlive() {
        properties.setRetryAttempts(0);
        try {
            EnrichmentRequest request = enqueue("LM358", 5);
            EnrichmentRequest leased = queue.lease(1).get(0);

            assertThat(queue.release(leased)).isTrue();

            assertThat(repository.findById(request.getId()).orElseThrow().getStatus())
                    .isEqualTo(EnrichmentStatus.PENDING);
            EnrichmentRequest again = queue.lease(1).get(0);
            assertThat(queue.nack(again, "supplier timeout")).isEqualTo(NackResult.FAILED);
        } finally {
            properties.setRetryAttempts(3);
        }
    }

    @Test
    void expiredLeaseOnFinalAttemptFailsRequest() {
        properties.setRetryAttempts(0);
        try {
            EnrichmentRequest request = enqueue("LM358", 5);
            queue.lease(1);
            clock.advance(Duration.ofMillis(properties.getStuckThresholdMs() + 1));

            EnrichmentQueue.RecoveredLeases recovered = queue.recoverExpiredLeases();

            assertThat(recovered.requeued()).isZero();
            assertThat(recovered.failed()).extracting(EnrichmentRequest::getId).containsExactly(request.getId());
            assertThat(repository.findById(request.getId()).orElseThrow().getStatus())
                    .isEqualTo(EnrichmentStatus.FAILED);
        } finally {
            properties.setRetryAttempts(3);
        }
    }

    @Test
    void freshLeaseIsNotRecovered() {
        enqueue("LM358", 5);
        queue.lease(1);

        assertThat(queue.recoverExpiredLeases().requeued()).isZero();
    }

    @Test
    void cancelStopsQueuedWorkForBatch() {
        UUID batchId = UUID.randomUUID();
        EnrichmentRequest queued = queue.enqueue(new NewEnrichmentRequest("LM358", "TI", 5, RequestSource.BOM_UPLOAD,
                "org-1", batchId, "BOM-1"));
        EnrichmentRequest other = enqueue("NE555", 5);

        assertThat(queue.cancelQueued(batchId)).isEqualTo(1);

        assertThat(repository.findById(queued.getId()).orElseThrow().getStatus())
                .isEqualTo(EnrichmentStatus.CANCELLED);
        assertThat(queue.lease(10)).extracting(EnrichmentRequest::getId).containsExactly(other.getId());
        assertThat(queue.cancel(queued.getId())).isFalse();
    }

    @Test
    void retryDelayDoublesPerAttempt() {
        assertThat(queue.retryDelay(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(queue.retryDelay(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(queue.retryDelay(3)).isEqualTo(Duration.ofSeconds(120));
    }

    private EnrichmentRequest enqueue(String mpn, int priority) {
        EnrichmentRequest request = queue.enqueue(new NewEnrichmentRequest(mpn, "TI", priority, RequestSource.MANUAL,
                "org-1", null, null));
        clock.advance(Duration.ofSeconds(1));
        return request;
    }
}
