package cns.core.enrichment.dto;

import cns.core.enrichment.domain.StorageTrackingRecord;
import java.time.Instant;

public record StorageTrackingView(String recordKey,
                                  String mpn,
                                  String manufacturer,
                                  String lineReference,
                                  String storageLocation,
                                  double qualityScore,
                                  String cacheKey,
                                  Instant expiresAt,
                                  boolean canPromote,
                                  String reasonForRedis,
                                  String placedBy,
                                  Instant promotedAt,
                                  Instant updatedAt) {
    public static StorageTrackingView from(StorageTrackingRecord record) {
        return new StorageTrackingView(record.getRecordKey(), record.getMpn(), record.getManufacturer(),
                record.getLineReference(), record.getStorageLocation().value(), record.getQualityScore(),
                record.getCacheKey(), record.getExpiresAt(), record.isCanPromote(), record.getReasonForRedis(),
                record.getPlacedBy(), record.getPromotedAt(), record.getUpdatedAt());
    }
}
