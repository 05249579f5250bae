package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "field_comparison", indexes = @Index(name = "idx_field_comparison_run", columnList = "audit_run_id"))
public class FieldComparison {

    @Id
    private UUID id;

    @Column(name = "audit_run_id", nullable = false)
    private UUID auditRunId;

    @Column(name = "field_name", nullable = false, length = 64)
    private String fieldName;

    @Lob
    @Column(name = "supplier_value")
    private String supplierValue;

    @Lob
    @Column(name = "stored_value")
    private String storedValue;

    @Lob
    @Column(name = "normalized_value")
    private String normalizedValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "field_status", nullable = false, length = 16)
    private FieldStatus status;

    @Column(name = "change_reason", length = 255)
    private String changeReason;

    @Column(nullable = false)
    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_data_quality", nullable = false, length = 16)
    private DataQuality sourceDataQuality;

    protected FieldComparison() {
    }

    public FieldComparison(UUID id, UUID auditRunId, String fieldName, String supplierValue, String storedValue,
                           String normalizedValue, FieldStatus status, String changeReason, double confidence,
                           DataQuality sourceDataQuality) {
        this.id = id;
        this.auditRunId = auditRunId;
        this.fieldName = fieldName;
        this.supplierValue = supplierValue;
        this.storedValue = storedValue;
        this.normalizedValue = normalizedValue;
        this.status = status;
        this.changeReason = changeReason;
        this.confidence = confidence;
        this.sourceDataQuality = sourceDataQuality;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAuditRunId() {
        return auditRunId;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getSupplierValue() {
        return supplierValue;
    }

    public String getStoredValue() {
        return storedValue;
    }

    public String getNormalizedValue() {
        return normalizedValue;
    }

    public FieldStatus getStatus() {
        return status;
    }

    public String getChangeReason() {
        return changeReason;
    }

    public double getConfidence() {
        return confidence;
    }

    public DataQuality getSourceDataQuality() {
        return sourceDataQuality;
    }
}
