package cns.core.enrichment.storage;

import java.time.Instant;
import java.util.Map;

public record CacheEntry(
        String recordKey,
        String mpn,
        String manufacturer,
        double qualityScore,
        Map<String, Object> fields,
        String reasonForRedis,
        boolean canPromote,
        String source,
        String fingerprint,
        Instant storedAt,
        Instant expiresAt) {
}
