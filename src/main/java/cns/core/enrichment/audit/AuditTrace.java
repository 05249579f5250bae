package cns.core.enrichment.audit;

import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.quality.ComparisonResult;
import cns.core.enrichment.supplier.SupplierLookup;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class AuditTrace {

    private final UUID requestId;
    private final UUID batchJobId;
    private final String organizationId;
    private final String recordKey;
    private final String mpn;
    private final String manufacturer;
    private final Instant startedAt;
    private final List<SupplierAttempt> attempts = new ArrayList<>();
    private final List<SupplierLookup> responses = new ArrayList<>();
    private String supplierId;
    private AuditOutcome outcome = AuditOutcome.ERROR;
    private ComparisonResult comparison;
    private Map<String, Object> normalizedPayload;
    private Double qualityScore;
    private Double matchConfidence;
    private String tier;
    private boolean needsReview;
    private String errorMessage;

    public AuditTrace(UUID requestId, UUID batchJobId, String organizationId, String recordKey,
                      String mpn, String manufacturer, Instant startedAt) {
        this.requestId = requestId;
        this.batchJobId = batchJobId;
        this.organizationId = organizationId;
        this.recordKey = recordKey;
        this.mpn = mpn;
        this.manufacturer = manufacturer;
        this.startedAt = startedAt;
    }

    public AuditTrace attempts(List<SupplierAttempt> values) {
        attempts.addAll(values);
        return this;
    }

    public AuditTrace responses(List<SupplierLookup> values) {
        responses.addAll(values);
        return this;
    }

    public AuditTrace chosen(String supplierId, double matchConfidence) {
        this.supplierId = supplierId;
        this.matchConfidence = matchConfidence;
        return this;
    }

    public AuditTrace evaluated(ComparisonResult comparison, double qualityScore) {
        this.comparison = comparison;
        this.normalizedPayload = comparison.normalized();
        this.qualityScore = qualityScore;
        return this;
    }

    public AuditTrace outcome(AuditOutcome outcome, String tier, boolean needsReview) {
        this.outcome = outcome;
        this.tier = tier;
        this.needsReview = needsReview;
        return this;
    }

    public AuditTrace error(String errorMessage) {
        this.errorMessage = errorMessage;
        return this;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public UUID getBatchJobId() {
        return batchJobId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getRecordKey() {
        return recordKey;
    }

    public String getMpn() {
        return mpn;
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public List<SupplierAttempt> getAttempts() {
        return List.copyOf(attempts);
    }

    public List<SupplierLookup> getResponses() {
        return List.copyOf(responses);
    }

    public String getSupplierId() {
        return supplierId;
    }

    public AuditOutcome getOutcome() {
        return outcome;
    }

    public ComparisonResult getComparison() {
        return comparison;
    }

    public Map<String, Object> getNormalizedPayload() {
        return normalizedPayload;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    public Double getMatchConfidence() {
        return matchConfidence;
    }

    public String getTier() {
        return tier;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
