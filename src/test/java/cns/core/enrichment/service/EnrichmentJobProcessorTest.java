package cns.core.enrichment.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import cns.core.enrichment.ComponentFixtures;
import cns.core.enrichment.MutableClock;
import cns.core.enrichment.audit.AuditRecorder;
import cns.core.enrichment.audit.AuditTrace;
import cns.core.enrichment.audit.SupplierAttempt;
import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.FieldStatus;
import cns.core.enrichment.domain.RequestSource;
import cns.core.enrichment.exception.StorageConflictException;
import cns.core.enrichment.policy.EnrichmentPolicy;
import cns.core.enrichment.policy.OrganizationPolicyService;
import cns.core.enrichment.quality.FieldComparator;
import cns.core.enrichment.quality.FieldNormalizer;
import cns.core.enrichment.quality.QualityScorer;
import cns.core.enrichment.quality.ScoringWeights;
import cns.core.enrichment.queue.EnrichmentQueue;
import cns.core.enrichment.queue.NackResult;
import cns.core.enrichment.resilience.CircuitBreakerSettings;
import cns.core.enrichment.resilience.RetryPolicy;
import cns.core.enrichment.storage.PlacementOutcome;
import cns.core.enrichment.storage.PlacementRequest;
import cns.core.enrichment.storage.PlacementResult;
import cns.core.enrichment.storage.RecordKey;
import cns.core.enrichment.storage.StorageRouter;
import cns.core.enrichment.storage.Tier;
import cns.core.enrichment.supplier.SupplierLookup;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EnrichmentJobProcessorTest {

    private static final UUID BATCH_ID = UUID.fromString("6f1c1d5e-6c9a-4d59-9f59-0c7a3c2d1b11");

    @Mock
    private EnrichmentQueue queue;
    @Mock
    private BatchJobService batchJobService;
    @Mock
    private OrganizationPolicyService policyService;
    @Mock
    private SupplierDispatcher dispatcher;
    @Mock
    private StorageRouter storageRouter;
    @Mock
    private AuditRecorder auditRecorder;

    private Semaphore semaphore;
    private EnrichmentProcessingMetrics metrics;
    private EnrichmentJobProcessor processor;
    private EnrichmentRequest request;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        semaphore = new Semaphore(2);
        metrics = new EnrichmentProcessingMetrics(clock);
        processor = new EnrichmentJobProcessor(queue, batchJobService, policyService, dispatcher,
                new FieldComparator(new FieldNormalizer()), new QualityScorer(), storageRouter, auditRecorder,
                semaphore, metrics, clock);
        request = new EnrichmentRequest(UUID.randomUUID(), "LM358", "TI", 5, RequestSource.BOM_UPLOAD, "org-1",
                BATCH_ID, "BOM-7");
    }

    @Test
    void completeSupplierResultIsPlacedInCatalogAndAcked() {
        stubPolicyAndDispatch(ComponentFixtures.lm358Without("eccn_code", "hts_code"));
        when(storageRouter.place(any(), any(), anyString()))
                .thenReturn(new PlacementResult(Tier.CATALOG, PlacementOutcome.PLACED_CATALOG, null));
        when(queue.ack(eq(request), anyDouble(), eq("catalog"), eq(false))).thenReturn(true);

        processor.process(request);

        ArgumentCaptor<PlacementRequest> placement = ArgumentCaptor.forClass(PlacementRequest.class);
        verify(storageRouter).place(placement.capture(), any(), eq("request:" + request.getId() + "#0"));
        assertThat(placement.getValue().key()).isEqualTo(RecordKey.of("LM358", "TI"));
        assertThat(placement.getValue().qualityScore()).isGreaterThanOrEqualTo(95.0);
        assertThat(placement.getValue().canPromote()).isTrue();
        assertThat(placement.getValue().lineReference()).isEqualTo("BOM-7");
        assertThat(placement.getValue().source()).isEqualTo("mouser");

        verify(batchJobService).markRunning(BATCH_ID);
        verify(batchJobService).recordChild(BATCH_ID, true);
        AuditTrace trace = capturedTrace();
        assertThat(trace.getOutcome()).isEqualTo(AuditOutcome.PLACED_CATALOG);
        assertThat(trace.getSupplierId()).isEqualTo("mouser");
        assertThat(trace.getErrorMessage()).isNull();
        assertThat(trace.getComparison().diffs()).hasSize(22);
        assertThat(metrics.getTotalSuccess()).isEqualTo(1);
        assertThat(semaphore.availablePermits()).isEqualTo(2);
    }

    @Test
    void sparseResultIsMarkedForReview() {
        stubPolicyAndDispatch(ComponentFixtures.lm358Only("mpn", "manufacturer", "description", "category",
                "unit_price", "stock_quantity", "package", "rohs_compliant", "image_url", "packaging"));
        when(storageRouter.place(any(), any(), anyString()))
                .thenReturn(new PlacementResult(Tier.UNPLACED, PlacementOutcome.NEEDS_REVIEW, "below threshold"));
        when(queue.ack(eq(request), anyDouble(), eq("needs_review"), eq(true))).thenReturn(true);

        processor.process(request);

        verify(batchJobService).recordChild(BATCH_ID, true);
        AuditTrace trace = capturedTrace();
        assertThat(trace.isNeedsReview()).isTrue();
        assertThat(trace.getErrorMessage()).isEqualTo("below threshold");
        assertThat(trace.getComparison().withStatus(FieldStatus.MISSING)).hasSize(12);
        assertThat(metrics.getTotalNeedsReview()).isEqualTo(1);
    }

    @Test
    void lostLeaseIsNotCountedTowardsBatch() {
        stubPolicyAndDispatch(ComponentFixtures.lm358AllFields());
        when(storageRouter.place(any(), any(), anyString()))
                .thenReturn(new PlacementResult(Tier.CATALOG, PlacementOutcome.UNCHANGED, "identical payload already stored"));
        when(queue.ack(eq(request), anyDouble(), eq("catalog"), eq(false))).thenReturn(false);

        processor.process(request);

        verify(batchJobService, never()).recordChild(any(), anyBoolean());
        assertThat(metrics.getTotalSuccess()).isZero();
        assertThat(semaphore.availablePermits()).isEqualTo(2);
    }

    @Test
    void recoveredSupplierErrorsAreKeptOnTheAuditRun() {
        when(policyService.resolve("org-1")).thenReturn(policy());
        SupplierLookup lookup = new SupplierLookup("digikey", true, "LM358", "Texas Instruments", 0.9,
                ComponentFixtures.lm358AllFields(), Map.of(), "{}");
        when(dispatcher.dispatch(eq("LM358"), eq("TI"), any())).thenReturn(new DispatchResult(lookup, 1.0, List.of(
                SupplierAttempt.skipped("mouser", SupplierAttempt.Result.SKIPPED_CIRCUIT_OPEN),
                new SupplierAttempt("digikey", SupplierAttempt.Result.FOUND, 2, 250, "recovered after: timeout")),
                List.of(lookup)));
        when(storageRouter.storedFields(RecordKey.of("LM358", "TI"))).thenReturn(Optional.empty());
        when(storageRouter.place(any(), any(), anyString()))
                .thenReturn(new PlacementResult(Tier.CATALOG, PlacementOutcome.PLACED_CATALOG, null));
        when(queue.ack(eq(request), anyDouble(), eq("catalog"), eq(false))).thenReturn(true);

        processor.process(request);

        AuditTrace trace = capturedTrace();
        assertThat(trace.getOutcome()).isEqualTo(AuditOutcome.PLACED_CATALOG);
        assertThat(trace.getErrorMessage())
                .isEqualTo("mouser=SKIPPED_CIRCUIT_OPEN, digikey=FOUND (recovered after: timeout)");
    }

    @Test
    void exhaustedSuppliersRequeueRequest() {
        when(policyService.resolve("org-1")).thenReturn(policy());
        when(dispatcher.dispatch(eq("LM358"), eq("TI"), any())).thenReturn(new DispatchResult(null, 0.0,
                List.of(new SupplierAttempt("mouser", SupplierAttempt.Result.FAILED, 3, 600, "timeout")), List.of()));
        when(queue.nack(eq(request), anyString())).thenReturn(NackResult.RETRY_SCHEDULED);

        processor.process(request);

        verify(queue).nack(eq(request), contains("All suppliers exhausted"));
        verify(queue, never()).ack(any(), anyDouble(), any(), anyBoolean());
        verify(batchJobService, never()).recordChild(any(), anyBoolean());
        assertThat(capturedTrace().getOutcome()).isEqualTo(AuditOutcome.EXHAUSTED);
        assertThat(metrics.getTotalRetryScheduled()).isEqualTo(1);
    }

    @Test
    void finalFailureCountsAgainstBatch() {
        when(policyService.resolve("org-1")).thenReturn(policy());
        when(dispatcher.dispatch(eq("LM358"), eq("TI"), any()))
                .thenReturn(new DispatchResult(null, 0.0, List.of(), List.of()));
        when(queue.nack(eq(request), anyString())).thenReturn(NackResult.FAILED);

        processor.process(request);

        verify(batchJobService).recordChild(BATCH_ID, false);
        assertThat(metrics.getTotalErrors()).isEqualTo(1);
    }

    @Test
    void storageConflictIsRetriedLater() {
        stubPolicyAndDispatch(ComponentFixtures.lm358AllFields());
        when(storageRouter.place(any(), any(), anyString()))
                .thenThrow(new StorageConflictException("LM358|TI", "Sync lock unavailable"));
        when(queue.nack(eq(request), anyString())).thenReturn(NackResult.RETRY_SCHEDULED);

        processor.process(request);

        verify(queue).nack(request, "Sync lock unavailable");
        assertThat(capturedTrace().getOutcome()).isEqualTo(AuditOutcome.STORAGE_CONFLICT);
        assertThat(metrics.getTotalConflicts()).isEqualTo(1);
        assertThat(semaphore.availablePermits()).isEqualTo(2);
    }

    @Test
    void unexpectedErrorIsNackedEvenWhenAuditFails() {
        when(policyService.resolve("org-1")).thenThrow(new IllegalStateException("settings table unavailable"));
        when(auditRecorder.record(any())).thenThrow(new IllegalStateException("audit down"));
        when(queue.nack(eq(request), anyString())).thenReturn(NackResult.RETRY_SCHEDULED);

        processor.process(request);

        verify(queue).nack(request, "Unexpected error: settings table unavailable");
    }

    @Test
    void requestOfCancelledBatchIsSkipped() {
        when(batchJobService.isCancelled(BATCH_ID)).thenReturn(true);
        when(queue.cancel(request.getId())).thenReturn(true);

        processor.process(request);

        verifyNoInteractions(dispatcher, storageRouter);
        assertThat(capturedTrace().getOutcome()).isEqualTo(AuditOutcome.CANCELLED);
        assertThat(metrics.getTotalCancelled()).isEqualTo(1);
    }

    @Test
    void recoveredFailuresAreCountedAgainstTheirBatch() {
        when(queue.recoverExpiredLeases()).thenReturn(new EnrichmentQueue.RecoveredLeases(2, List.of(request)));

        assertThat(processor.recoverExpiredLeases()).isEqualTo(3);

        verify(batchJobService).recordChild(BATCH_ID, false);
        assertThat(metrics.getTotalLeasesRecovered()).isEqualTo(3);
    }

    private void stubPolicyAndDispatch(Map<String, Object> fields) {
        when(policyService.resolve("org-1")).thenReturn(policy());
        SupplierLookup lookup = new SupplierLookup("mouser", true, "LM358", "Texas Instruments", 0.9, fields,
                Map.of(), "{}");
        when(dispatcher.dispatch(eq("LM358"), eq("TI"), any())).thenReturn(new DispatchResult(lookup, 1.0,
                List.of(new SupplierAttempt("mouser", SupplierAttempt.Result.FOUND, 1, 0, null)), List.of(lookup)));
        when(storageRouter.storedFields(RecordKey.of("LM358", "TI"))).thenReturn(Optional.empty());
    }

    private AuditTrace capturedTrace() {
        ArgumentCaptor<AuditTrace> trace = ArgumentCaptor.forClass(AuditTrace.class);
        verify(auditRecorder).record(trace.capture());
        return trace.getValue();
    }

    private static EnrichmentPolicy policy() {
        return new EnrichmentPolicy("org-1", 95, 80, Duration.ofHours(72), true, true, List.of("mouser"), Set.of(),
                0.5, CircuitBreakerSettings.disabled(), RetryPolicy.disabled(), ScoringWeights.defaults());
    }
}
