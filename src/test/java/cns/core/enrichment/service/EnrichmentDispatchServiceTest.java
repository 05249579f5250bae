package cns.core.enrichment.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.RequestSource;
import cns.core.enrichment.queue.EnrichmentQueue;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class EnrichmentDispatchServiceTest {

    @Mock
    private EnrichmentQueue queue;
    @Mock
    private EnrichmentJobProcessor processor;
    @Mock
    private TaskExecutor rejectingExecutor;

    @Test
    void leasesNoMoreThanFreeWorkerSlots() {
        Semaphore semaphore = new Semaphore(3);
        semaphore.acquireUninterruptibly(2);
        EnrichmentRequest request = request("LM358");
        when(processor.recoverExpiredLeases()).thenReturn(1);
        when(queue.lease(1)).thenReturn(List.of(request));

        DispatchSummary summary = service(new SyncTaskExecutor(), semaphore).dispatchPending();

        assertThat(summary.claimed()).isEqualTo(1);
        assertThat(summary.leasesRecovered()).isEqualTo(1);
        verify(processor).process(request);
    }

    @Test
    void batchSizeCapsLeaseWhenWorkersAreIdle() {
        when(queue.lease(2)).thenReturn(List.of());

        DispatchSummary summary = service(new SyncTaskExecutor(), new Semaphore(8)).dispatchPending();

        assertThat(summary.claimed()).isZero();
        verify(queue).lease(2);
    }

    @Test
    void rejectedTaskIsReleasedWithoutChargingAnAttempt() {
        EnrichmentRequest request = request("NE555");
        when(queue.lease(2)).thenReturn(List.of(request));
        doThrow(new TaskRejectedException("full")).when(rejectingExecutor).execute(any(Runnable.class));

        DispatchSummary summary = service(rejectingExecutor, new Semaphore(4)).dispatchPending();

        assertThat(summary.claimed()).isZero();
        verify(queue).release(request);
        verify(queue, never()).nack(any(), any());
        verify(processor, never()).process(any());
    }

    private EnrichmentDispatchService service(TaskExecutor executor, Semaphore semaphore) {
        EnrichmentProperties properties = new EnrichmentProperties();
        properties.setBatchSize(2);
        return new EnrichmentDispatchService(queue, processor, properties, executor, semaphore);
    }

    private static EnrichmentRequest request(String mpn) {
        return new EnrichmentRequest(UUID.randomUUID(), mpn, null, 5, RequestSource.MANUAL, "org-1", null, null);
    }
}
