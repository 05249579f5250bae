package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "storage_tracking", indexes = @Index(name = "idx_storage_tracking_expiry", columnList = "storage_location, expires_at"))
public class StorageTrackingRecord {

    @Id
    @Column(name = "record_key", length = 400)
    private String recordKey;

    @Column(nullable = false, length = 128)
    private String mpn;

    @Column(nullable = false, length = 255)
    private String manufacturer;

    @Column(name = "line_reference", length = 128)
    private String lineReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "storage_location", nullable = false, length = 16)
    private StorageLocation storageLocation;

    @Column(name = "quality_score", nullable = false)
    private double qualityScore;

    @Column(name = "cache_key", length = 512)
    private String cacheKey;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "can_promote", nullable = false)
    private boolean canPromote;

    @Column(name = "reason_for_redis", length = 512)
    private String reasonForRedis;

    @Column(name = "payload_fingerprint", length = 64)
    private String payloadFingerprint;

    @Column(name = "placed_by", length = 128)
    private String placedBy;

    @Column(name = "promoted_at")
    private Instant promotedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected StorageTrackingRecord() {
    }

    public StorageTrackingRecord(String recordKey, String mpn, String manufacturer) {
        this.recordKey = recordKey;
        this.mpn = mpn;
        this.manufacturer = manufacturer;
    }

    public void pointToCatalog(double qualityScore, String fingerprint, String placedBy, Instant now) {
        boolean promoted = storageLocation == StorageLocation.REDIS;
        this.storageLocation = StorageLocation.DATABASE;
        this.qualityScore = qualityScore;
        this.payloadFingerprint = fingerprint;
        this.placedBy = placedBy;
        this.cacheKey = null;
        this.expiresAt = null;
        this.canPromote = false;
        this.reasonForRedis = null;
        if (promoted) {
            this.promotedAt = now;
        }
        this.updatedAt = now;
    }

    public void pointToCache(double qualityScore, String fingerprint, String cacheKey, Instant expiresAt,
                             boolean canPromote, String reasonForRedis, String placedBy, Instant now) {
        this.storageLocation = StorageLocation.REDIS;
        this.qualityScore = qualityScore;
        this.payloadFingerprint = fingerprint;
        this.cacheKey = cacheKey;
        this.expiresAt = expiresAt;
        this.canPromote = canPromote;
        this.reasonForRedis = reasonForRedis;
        this.placedBy = placedBy;
        this.updatedAt = now;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
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

    public String getLineReference() {
        return lineReference;
    }

    public void setLineReference(String lineReference) {
        this.lineReference = lineReference;
    }

    public StorageLocation getStorageLocation() {
        return storageLocation;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isCanPromote() {
        return canPromote;
    }

    public String getReasonForRedis() {
        return reasonForRedis;
    }

    public String getPayloadFingerprint() {
        return payloadFingerprint;
    }

    public String getPlacedBy() {
        return placedBy;
    }

    public Instant getPromotedAt() {
        return promotedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
