package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "supplier_result", indexes = @Index(name = "idx_supplier_result_request", columnList = "request_id"))
public class SupplierResult {

    @Id
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(name = "audit_run_id")
    private UUID auditRunId;

    @Column(name = "supplier_id", nullable = false, length = 64)
    private String supplierId;

    @Column(nullable = false)
    private boolean found;

    @Lob
    @Column(name = "raw_payload")
    private String rawPayload;

    @Lob
    @Column(name = "normalized_payload")
    private String normalizedPayload;

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    protected SupplierResult() {
    }

    public SupplierResult(UUID id, UUID requestId, UUID auditRunId, String supplierId, boolean found,
                          String rawPayload, String normalizedPayload, Instant fetchedAt) {
        this.id = id;
        this.requestId = requestId;
        this.auditRunId = auditRunId;
        this.supplierId = supplierId;
        this.found = found;
        this.rawPayload = rawPayload;
        this.normalizedPayload = normalizedPayload;
        this.fetchedAt = fetchedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public UUID getAuditRunId() {
        return auditRunId;
    }

    public String getSupplierId() {
        return supplierId;
    }

    public boolean isFound() {
        return found;
    }

    public String getRawPayload() {
        return rawPayload;
    }

    public String getNormalizedPayload() {
        return normalizedPayload;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }
}
