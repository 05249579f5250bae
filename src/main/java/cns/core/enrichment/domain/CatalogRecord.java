package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "catalog_component",
        uniqueConstraints = @UniqueConstraint(name = "uq_catalog_component_mpn_mfr", columnNames = {"mpn", "manufacturer"}))
public class CatalogRecord {

    @Id
    private UUID id;

    @Column(name = "record_key", nullable = false, unique = true, length = 400)
    private String recordKey;

    @Column(nullable = false, length = 128)
    private String mpn;

    @Column(nullable = false, length = 255)
    private String manufacturer;

    @Lob
    private String description;

    @Column(length = 255)
    private String category;

    @Column(name = "lifecycle_status", length = 64)
    private String lifecycleStatus;

    @Column(name = "datasheet_url", length = 1024)
    private String datasheetUrl;

    @Column(name = "quality_score", nullable = false)
    private double qualityScore;

    @Lob
    @Column(name = "specifications_json")
    private String specificationsJson;

    @Lob
    @Column(name = "pricing_json")
    private String pricingJson;

    @Lob
    @Column(name = "metadata_json")
    private String metadataJson;

    @Column(name = "enrichment_source", length = 64)
    private String enrichmentSource;

    @Column(name = "payload_fingerprint", length = 64)
    private String payloadFingerprint;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CatalogRecord() {
    }

    public CatalogRecord(UUID id, String recordKey, String mpn, String manufacturer) {
        this.id = id;
        this.recordKey = recordKey;
        this.mpn = mpn;
        this.manufacturer = manufacturer;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getLifecycleStatus() {
        return lifecycleStatus;
    }

    public void setLifecycleStatus(String lifecycleStatus) {
        this.lifecycleStatus = lifecycleStatus;
    }

    public String getDatasheetUrl() {
        return datasheetUrl;
    }

    public void setDatasheetUrl(String datasheetUrl) {
        this.datasheetUrl = datasheetUrl;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public void setQualityScore(double qualityScore) {
        this.qualityScore = qualityScore;
    }

    public String getSpecificationsJson() {
        return specificationsJson;
    }

    public void setSpecificationsJson(String specificationsJson) {
        this.specificationsJson = specificationsJson;
    }

    public String getPricingJson() {
        return pricingJson;
    }

    public void setPricingJson(String pricingJson) {
        this.pricingJson = pricingJson;
    }

    public String getMetadataJson() {
        return metadataJson;
    }

    public void setMetadataJson(String metadataJson) {
        this.metadataJson = metadataJson;
    }

    public String getEnrichmentSource() {
        return enrichmentSource;
    }

    public void setEnrichmentSource(String enrichmentSource) {
        this.enrichmentSource = enrichmentSource;
    }

    public String getPayloadFingerprint() {
        return payloadFingerprint;
    }

    public void setPayloadFingerprint(String payloadFingerprint) {
        this.payloadFingerprint = payloadFingerprint;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
