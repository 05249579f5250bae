package cns.core.enrichment.service;

import cns.core.enrichment.audit.AuditRecorder;
import cns.core.enrichment.audit.AuditTrace;
import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.exception.ExhaustionException;
import cns.core.enrichment.exception.StorageConflictException;
import cns.core.enrichment.policy.EnrichmentPolicy;
import cns.core.enrichment.policy.OrganizationPolicyService;
import cns.core.enrichment.quality.ComparisonResult;
import cns.core.enrichment.quality.FieldComparator;
import cns.core.enrichment.quality.QualityScore;
import cns.core.enrichment.quality.QualityScorer;
import cns.core.enrichment.queue.EnrichmentQueue;
import cns.core.enrichment.queue.NackResult;
import cns.core.enrichment.storage.PlacementRequest;
import cns.core.enrichment.storage.PlacementResult;
import cns.core.enrichment.storage.RecordKey;
import cns.core.enrichment.storage.StorageRouter;
import cns.core.enrichment.supplier.SupplierLookup;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EnrichmentJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentJobProcessor.class);
    private final EnrichmentQueue queue;
    private final BatchJobService batchJobService;
    private final OrganizationPolicyService policyService;
    private final SupplierDispatcher dispatcher;
    private final FieldComparator comparator;
    private final QualityScorer scorer;
    private final StorageRouter storageRouter;
    private final AuditRecorder auditRecorder;
    private final Semaphore semaphore;
    private final EnrichmentProcessingMetrics metrics;
    private final Clock clock;

    public EnrichmentJobProcessor(EnrichmentQueue queue,
                                  BatchJobService batchJobService,
                                  OrganizationPolicyService policyService,
                                  SupplierDispatcher dispatcher,
                                  FieldComparator comparator,
                                  QualityScorer scorer,
                                  StorageRouter storageRouter,
                                  AuditRecorder auditRecorder,
                                  Semaphore semaphore,
                                  EnrichmentProcessingMetrics metrics,
                                  Clock clock) {
        this.queue = queue;
        this.batchJobService = batchJobService;
        this.policyService = policyService;
        this.dispatcher = dispatcher;
        this.comparator = comparator;
        this.scorer = scorer;
        this.storageRouter = storageRouter;
        this.auditRecorder = auditRecorder;
        this.semaphore = semaphore;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void process(EnrichmentRequest request) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(request, "Interrupted while waiting for a worker slot", Instant.now(clock));
            return;
        }
        try {
            processLeased(request);
        } finally {
            semaphore.release();
        }
    }

    private void processLeased(EnrichmentRequest request) {
        Instant started = clock.instant();
        RecordKey key = RecordKey.of(request.getMpn(), request.getManufacturer());
        AuditTrace trace = new AuditTrace(request.getId(), request.getBatchJobId(), request.getOrganizationId(),
                key.value(), request.getMpn(), request.getManufacturer(), started);

        if (request.getBatchJobId() != null && batchJobService.isCancelled(request.getBatchJobId())) {
            if (queue.cancel(request.getId())) {
                metrics.recordCancelled();
                auditRecorder.record(trace.outcome(AuditOutcome.CANCELLED, null, false)
                        .error("Batch job cancelled before start"));
                log.info("Skipped cancelled requestId={} batchJobId={}", request.getId(), request.getBatchJobId());
            }
            return;
        }
        batchJobService.markRunning(request.getBatchJobId());

        try {
            EnrichmentPolicy policy = policyService.resolve(request.getOrganizationId());
            DispatchResult dispatch = dispatcher.dispatch(request.getMpn(), request.getManufacturer(), policy);
            trace.attempts(dispatch.attempts()).responses(dispatch.responses());
            SupplierLookup lookup = dispatch.requireUsable();
            trace.chosen(lookup.supplierId(), dispatch.matchConfidence());

            Map<String, Object> stored = storageRouter.storedFields(key).orElse(null);
            ComparisonResult comparison = comparator.compare(lookup.fields(), lookup.fieldConfidence(),
                    lookup.confidence(), stored);
            QualityScore score = scorer.score(comparison, dispatch.matchConfidence(), policy.scoring());
            trace.evaluated(comparison, score.overall());

            PlacementResult placement = storageRouter.place(
                    new PlacementRequest(key, request.getLineReference(), score.overall(), comparison.normalized(),
                            comparison.requiredFieldsPresent(), lookup.supplierId()),
                    policy,
                    holder(request));
            trace.outcome(placement.outcome().auditOutcome(), placement.tier().label(), placement.needsReview())
                    .error(joinErrors(placement.needsReview() ? placement.reason() : null, dispatch.supplierErrors()));
            auditRecorder.record(trace);

            if (!queue.ack(request, score.overall(), placement.tier().label(), placement.needsReview())) {
                log.warn("Lease lost before ack requestId={} attempt={}", request.getId(), request.getAttemptCount());
                return;
            }
            batchJobService.recordChild(request.getBatchJobId(), true);
            metrics.recordSuccess(Duration.between(started, clock.instant()).toMillis(), placement.needsReview());
            log.info("Request enriched requestId={} mpn={} supplier={} score={} tier={} outcome={}",
                    request.getId(), request.getMpn(), lookup.supplierId(), score.overall(),
                    placement.tier().label(), placement.outcome());
        } catch (ExhaustionException ex) {
            log.warn("Suppliers exhausted requestId={} mpn={} message={}", request.getId(), request.getMpn(),
                    ex.getMessage());
            auditRecorder.record(trace.outcome(AuditOutcome.EXHAUSTED, null, false).error(ex.getMessage()));
            fail(request, ex.getMessage(), started);
        } catch (StorageConflictException ex) {
            log.warn("Placement deferred requestId={} key={} message={}", request.getId(), ex.getRecordKey(),
                    ex.getMessage());
            metrics.recordConflict();
            auditRecorder.record(trace.outcome(AuditOutcome.STORAGE_CONFLICT, null, false).error(ex.getMessage()));
            fail(request, ex.getMessage(), started);
        } catch (RuntimeException ex) {
            log.error("Unexpected error requestId={} mpn={}", request.getId(), request.getMpn(), ex);
            String message = "Unexpected error: " + ex.getMessage();
            recordErrorTrace(trace, message);
            fail(request, message, started);
        }
    }

    private void recordErrorTrace(AuditTrace trace, String message) {
        try {
            auditRecorder.record(trace.outcome(AuditOutcome.ERROR, null, false).error(message));
        } catch (RuntimeException auditFailure) {
            log.error("Audit write failed requestId={}", trace.getRequestId(), auditFailure);
        }
    }

    private void fail(EnrichmentRequest request, String message, Instant started) {
        NackResult result = queue.nack(request, message);
        if (result == NackResult.RETRY_SCHEDULED) {
            metrics.recordRetry();
        } else if (result == NackResult.FAILED) {
            batchJobService.recordChild(request.getBatchJobId(), false);
            metrics.recordError(Duration.between(started, clock.instant()).toMillis());
        }
    }

    public int recoverExpiredLeases() {
        EnrichmentQueue.RecoveredLeases recovered = queue.recoverExpiredLeases();
        for (EnrichmentRequest failed : recovered.failed()) {
            batchJobService.recordChild(failed.getBatchJobId(), false);
        }
        int total = recovered.requeued() + recovered.failed().size();
        metrics.recordLeasesRecovered(total);
        return total;
    }

    private static String joinErrors(String placementReason, String supplierErrors) {
        if (placementReason == null) {
            return supplierErrors;
        }
        return supplierErrors == null ? placementReason : placementReason + "; suppliers: " + supplierErrors;
    }

    private static String holder(EnrichmentRequest request) {
        return "request:" + request.getId() + "#" + request.getAttemptCount();
    }
}
