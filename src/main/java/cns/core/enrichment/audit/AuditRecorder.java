package cns.core.enrichment.audit;

import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.domain.AuditRun;
import cns.core.enrichment.domain.FieldComparison;
import cns.core.enrichment.domain.ReviewStatus;
import cns.core.enrichment.domain.SupplierResult;
import cns.core.enrichment.exception.ResourceNotFoundException;
import cns.core.enrichment.quality.FieldDiff;
import cns.core.enrichment.repository.AuditRunRepository;
import cns.core.enrichment.repository.FieldComparisonRepository;
import cns.core.enrichment.repository.SupplierResultRepository;
import cns.core.enrichment.storage.RecordKey;
import cns.core.enrichment.supplier.SupplierLookup;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);
    private final AuditRunRepository runRepository;
    private final FieldComparisonRepository comparisonRepository;
    private final SupplierResultRepository supplierResultRepository;
    private final TransactionOperations transactions;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditRecorder(AuditRunRepository runRepository,
                         FieldComparisonRepository comparisonRepository,
                         SupplierResultRepository supplierResultRepository,
                         TransactionOperations transactions,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.runRepository = runRepository;
        this.comparisonRepository = comparisonRepository;
        this.supplierResultRepository = supplierResultRepository;
        this.transactions = transactions;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public AuditRun record(AuditTrace trace) {
        Instant finishedAt = clock.instant();
        UUID runId = UUID.randomUUID();
        AuditRun run = new AuditRun(runId, trace.getRequestId(), trace.getBatchJobId(), trace.getOrganizationId(),
                trace.getRecordKey(), trace.getMpn(), trace.getManufacturer(), trace.getSupplierId(),
                trace.getOutcome(), trace.getQualityScore(), trace.getMatchConfidence(), trace.getTier(),
                trace.isNeedsReview(), trace.getStartedAt(), finishedAt, trace.getErrorMessage(),
                toJson(trace.getAttempts()));

        List<FieldComparison> comparisons = new ArrayList<>();
        if (trace.getComparison() != null) {
            for (FieldDiff diff : trace.getComparison().diffs()) {
                comparisons.add(new FieldComparison(UUID.randomUUID(), runId, diff.field(), diff.supplierValue(),
                        diff.storedValue(), diff.normalizedValue(), diff.status(), diff.changeReason(),
                        diff.confidence(), diff.sourceDataQuality()));
            }
        }
        List<SupplierResult> results = new ArrayList<>();
        for (SupplierLookup lookup : trace.getResponses()) {
            boolean chosen = Objects.equals(lookup.supplierId(), trace.getSupplierId()) && lookup.found();
            String normalized = chosen && trace.getNormalizedPayload() != null
                    ? toJson(trace.getNormalizedPayload())
                    : null;
            results.add(new SupplierResult(UUID.randomUUID(), trace.getRequestId(), runId, lookup.supplierId(),
                    lookup.found(), lookup.rawPayload(), normalized, finishedAt));
        }

        transactions.executeWithoutResult(status -> {
            runRepository.save(run);
            comparisonRepository.saveAll(comparisons);
            if (trace.getRequestId() != null) {
                supplierResultRepository.saveAll(results);
            }
        });
        log.info("Audit run recorded runId={} requestId={} outcome={} score={} comparisons={}",
                runId, trace.getRequestId(), trace.getOutcome(), trace.getQualityScore(), comparisons.size());
        return run;
    }

    /**
     * Audit entry for storage events that happen outside a worker run: expiry, manual
     * promotion, reconciliation.
     */
    public AuditRun recordStorageEvent(RecordKey key, AuditOutcome outcome, Double qualityScore, String tier,
                                       String message) {
        Instant now = clock.instant();
        AuditRun run = new AuditRun(UUID.randomUUID(), null, null, null, key.value(), key.mpn(),
                key.manufacturer(), null, outcome, qualityScore, null, tier, false, now, now, message, null);
        return runRepository.save(run);
    }

    public AuditRun review(UUID runId, ReviewStatus status, String reviewer, String note) {
        AuditRun run = runRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Audit run not found: " + runId));
        run.annotateReview(status, reviewer, note, clock.instant());
        log.info("Audit run reviewed runId={} status={} reviewer={}", runId, status, reviewer);
        return runRepository.save(run);
    }

    public List<AuditRun> runsForRequest(UUID requestId) {
        return runRepository.findByRequestIdOrderByStartedAtAsc(requestId);
    }

    public List<AuditRun> recentRuns(int limit) {
        return runRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public List<FieldComparison> comparisons(UUID runId) {
        if (!runRepository.existsById(runId)) {
            throw new ResourceNotFoundException("Audit run not found: " + runId);
        }
        return comparisonRepository.findByAuditRunIdOrderByFieldNameAsc(runId);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize audit payload", ex);
        }
    }
}
