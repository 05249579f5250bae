package cns.core.enrichment.storage;

import cns.core.enrichment.audit.AuditRecorder;
import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.domain.StorageLocation;
import cns.core.enrichment.domain.StorageTrackingRecord;
import cns.core.enrichment.exception.PromotionRejectedException;
import cns.core.enrichment.exception.ResourceNotFoundException;
import cns.core.enrichment.exception.StorageConflictException;
import cns.core.enrichment.lock.SyncLock;
import cns.core.enrichment.policy.EnrichmentPolicy;
import cns.core.enrichment.repository.StorageTrackingRepository;
import cns.core.enrichment.resilience.Sleeper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

@Service
public class StorageRouter {

    private static final Logger log = LoggerFactory.getLogger(StorageRouter.class);
    private static final int SWEEP_PAGE_SIZE = 500;

    private final CatalogStore catalogStore;
    private final CacheStore cacheStore;
    private final StorageTrackingRepository trackingRepository;
    private final SyncLock syncLock;
    private final AuditRecorder auditRecorder;
    private final TransactionOperations transactions;
    private final ObjectMapper objectMapper;
    private final EnrichmentProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<PlacementOutcome, Counter> placementCounters = new EnumMap<>(PlacementOutcome.class);

    @Autowired
    public StorageRouter(CatalogStore catalogStore,
                         CacheStore cacheStore,
                         StorageTrackingRepository trackingRepository,
                         SyncLock syncLock,
                         AuditRecorder auditRecorder,
                         TransactionOperations transactions,
                         ObjectMapper objectMapper,
                         EnrichmentProperties properties,
                         Clock clock,
                         ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(catalogStore, cacheStore, trackingRepository, syncLock, auditRecorder, transactions, objectMapper,
                properties, clock, Sleeper.THREAD, meterRegistryProvider.getIfAvailable());
    }

    public StorageRouter(CatalogStore catalogStore,
                         CacheStore cacheStore,
                         StorageTrackingRepository trackingRepository,
                         SyncLock syncLock,
                         AuditRecorder auditRecorder,
                         TransactionOperations transactions,
                         ObjectMapper objectMapper,
                         EnrichmentProperties properties,
                         Clock clock,
                         Sleeper sleeper,
                         MeterRegistry registry) {
        this.catalogStore = catalogStore;
        this.cacheStore = cacheStore;
        this.trackingRepository = trackingRepository;
        this.syncLock = syncLock;
        this.auditRecorder = auditRecorder;
        this.transactions = transactions;
        this.objectMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        if (registry != null) {
            for (PlacementOutcome outcome : PlacementOutcome.values()) {
                placementCounters.put(outcome, Counter.builder("cns.storage.placement")
                        .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                        .register(registry));
            }
        }
    }

    public Tier decideTier(double qualityScore, EnrichmentPolicy policy) {
        if (policy.catalogEnabled() && qualityScore >= policy.catalogThreshold()) {
            return Tier.CATALOG;
        }
        if (policy.cacheEnabled() && qualityScore >= policy.cacheThreshold()) {
            return Tier.CACHE;
        }
        return Tier.UNPLACED;
    }

    public PlacementResult place(PlacementRequest request, EnrichmentPolicy policy, String holder) {
        Tier target = decideTier(request.qualityScore(), policy);
        if (target == Tier.UNPLACED) {
            String reason = String.format("quality_score %.2f below cache threshold %.2f",
                    request.qualityScore(), policy.cacheThreshold());
            return count(new PlacementResult(Tier.UNPLACED, PlacementOutcome.NEEDS_REVIEW, reason));
        }
        String fingerprint = fingerprint(request.fields());
        return count(withLock(request.key(), holder, () -> {
            StorageTrackingRecord tracking = trackingRepository.findById(request.key().value()).orElse(null);
            StorageLocation current = tracking == null ? null : tracking.getStorageLocation();

            if (current == StorageLocation.DATABASE && target == Tier.CACHE) {
                String reason = String.format("catalog entry retained, quality_score %.2f below catalog threshold %.2f",
                        request.qualityScore(), policy.catalogThreshold());
                return new PlacementResult(Tier.CATALOG, PlacementOutcome.RETAINED_CATALOG, reason);
            }
            if (tracking != null && fingerprint.equals(tracking.getPayloadFingerprint())
                    && current == location(target) && presentIn(tracking)) {
                if (target == Tier.CACHE) {
                    writeCache(request, fingerprint, tracking, policy.cacheTtl(), cacheReason(request, policy), holder);
                } else {
                    tracking.touch(clock.instant());
                    trackingRepository.save(tracking);
                }
                return new PlacementResult(target, PlacementOutcome.UNCHANGED, "identical payload already stored");
            }
            if (target == Tier.CATALOG) {
                boolean promotion = current == StorageLocation.REDIS;
                writeCatalog(request.key(), request.lineReference(), request.fields(), request.qualityScore(),
                        request.source(), fingerprint, tracking, holder);
                log.info("Placed in catalog key={} score={} promotion={}", request.key(), request.qualityScore(), promotion);
                return new PlacementResult(Tier.CATALOG,
                        promotion ? PlacementOutcome.PROMOTED : PlacementOutcome.PLACED_CATALOG, null);
            }
            String reason = cacheReason(request, policy);
            writeCache(request, fingerprint, tracking, policy.cacheTtl(), reason, holder);
            log.info("Placed in cache key={} score={} ttl={}", request.key(), request.qualityScore(), policy.cacheTtl());
            return new PlacementResult(Tier.CACHE, PlacementOutcome.PLACED_CACHE, reason);
        }));
    }

    /**
     * Operator promotion of a cache entry flagged {@code can_promote}.
     */
    public PlacementResult promote(RecordKey key, String operator) {
        PlacementResult result = withLock(key, operator, () -> {
            StorageTrackingRecord tracking = trackingRepository.findById(key.value())
                    .orElseThrow(() -> new ResourceNotFoundException("No storage tracking for " + key));
            if (tracking.getStorageLocation() != StorageLocation.REDIS) {
                throw new PromotionRejectedException("Record " + key + " is not in the cache tier");
            }
            if (!tracking.isCanPromote()) {
                throw new PromotionRejectedException("Record " + key + " is not eligible for promotion");
            }
            CacheEntry entry = cacheStore.get(tracking.getCacheKey())
                    .map(this::readEntry)
                    .orElseThrow(() -> new PromotionRejectedException("Cache entry for " + key + " has expired"));
            writeCatalog(key, tracking.getLineReference(), entry.fields(), entry.qualityScore(), entry.source(),
                    entry.fingerprint(), tracking, operator);
            log.info("Manually promoted key={} operator={} score={}", key, operator, entry.qualityScore());
            return new PlacementResult(Tier.CATALOG, PlacementOutcome.PROMOTED, "manual promotion by " + operator);
        });
        auditRecorder.recordStorageEvent(key, AuditOutcome.MANUAL_PROMOTION, null, Tier.CATALOG.label(),
                result.reason());
        return result;
    }

    /**
     * Removes cache entries whose expiry has passed together with their tracking rows.
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        List<StorageTrackingRecord> expired = trackingRepository.findByStorageLocationAndExpiresAtLessThanEqual(
                StorageLocation.REDIS, now, PageRequest.of(0, SWEEP_PAGE_SIZE));
        int removed = 0;
        for (StorageTrackingRecord candidate : expired) {
            RecordKey key = RecordKey.parse(candidate.getRecordKey());
            try {
                boolean swept = withLock(key, "expiry-sweeper", () -> {
                    StorageTrackingRecord current = trackingRepository.findById(key.value()).orElse(null);
                    if (current == null || current.getStorageLocation() != StorageLocation.REDIS
                            || current.getExpiresAt() == null || current.getExpiresAt().isAfter(now)) {
                        return false;
                    }
                    cacheStore.delete(current.getCacheKey());
                    trackingRepository.delete(current);
                    return true;
                });
                if (swept) {
                    removed++;
                    auditRecorder.recordStorageEvent(key, AuditOutcome.CACHE_EXPIRED, candidate.getQualityScore(),
                            Tier.CACHE.label(), "cache entry expired at " + candidate.getExpiresAt());
                }
            } catch (StorageConflictException ex) {
                log.warn("Expiry sweep skipped locked key={}", key);
            }
        }
        if (removed > 0) {
            log.info("Expired cache entries removed count={}", removed);
        }
        return removed;
    }

    /**
     * Brings tracking rows back in line with what the two stores actually hold. Drift is
     * detected page by page with bulk reads; only drifted keys are locked and re-checked.
     */
    public int reconcile() {
        int fixed = 0;
        String after = "";
        List<StorageTrackingRecord> page;
        do {
            page = trackingRepository.findByRecordKeyGreaterThanOrderByRecordKeyAsc(after,
                    PageRequest.of(0, SWEEP_PAGE_SIZE));
            for (StorageTrackingRecord tracked : drifted(page)) {
                RecordKey key = RecordKey.parse(tracked.getRecordKey());
                fixed += applyFix(key, tracked.getQualityScore(), tracked.getStorageLocation(),
                        () -> reconcileKey(key));
            }
            if (!page.isEmpty()) {
                after = page.get(page.size() - 1).getRecordKey();
            }
        } while (page.size() == SWEEP_PAGE_SIZE);

        after = "";
        List<String> catalogKeys;
        do {
            catalogKeys = catalogStore.recordKeysAfter(after, SWEEP_PAGE_SIZE);
            Set<String> tracked = new HashSet<>();
            trackingRepository.findAllById(catalogKeys).forEach(row -> tracked.add(row.getRecordKey()));
            for (String recordKey : catalogKeys) {
                if (!tracked.contains(recordKey)) {
                    RecordKey key = RecordKey.parse(recordKey);
                    fixed += applyFix(key, null, StorageLocation.DATABASE, () -> adoptUntrackedCatalog(key));
                }
            }
            if (!catalogKeys.isEmpty()) {
                after = catalogKeys.get(catalogKeys.size() - 1);
            }
        } while (catalogKeys.size() == SWEEP_PAGE_SIZE);
        return fixed;
    }

    public Optional<StorageTrackingRecord> tracking(RecordKey key) {
        return trackingRepository.findById(key.value());
    }

    public List<StorageTrackingRecord> cacheEntries(int limit) {
        return trackingRepository.findByStorageLocationOrderByUpdatedAtDesc(StorageLocation.REDIS,
                PageRequest.of(0, Math.max(1, limit)));
    }

    public Optional<Map<String, Object>> storedFields(RecordKey key) {
        StorageTrackingRecord tracking = trackingRepository.findById(key.value()).orElse(null);
        if (tracking == null) {
            return Optional.empty();
        }
        if (tracking.getStorageLocation() == StorageLocation.DATABASE) {
            return catalogStore.find(key.value()).map(StoredComponent::fields);
        }
        return cacheStore.get(tracking.getCacheKey()).map(this::readEntry).map(CacheEntry::fields);
    }

    String cacheKey(RecordKey key) {
        return properties.getCacheKeyPrefix() + key.value();
    }

    private List<StorageTrackingRecord> drifted(List<StorageTrackingRecord> page) {
        if (page.isEmpty()) {
            return List.of();
        }
        List<String> cacheKeys = new ArrayList<>();
        List<String> catalogKeys = new ArrayList<>();
        for (StorageTrackingRecord tracked : page) {
            if (tracked.getStorageLocation() == StorageLocation.REDIS) {
                if (tracked.getCacheKey() != null) {
                    cacheKeys.add(tracked.getCacheKey());
                }
            } else {
                catalogKeys.add(tracked.getRecordKey());
                cacheKeys.add(cacheKey(RecordKey.parse(tracked.getRecordKey())));
            }
        }
        Set<String> cached = cacheStore.existing(cacheKeys);
        Set<String> cataloged = catalogStore.existingKeys(catalogKeys);
        List<StorageTrackingRecord> drifted = new ArrayList<>();
        for (StorageTrackingRecord tracked : page) {
            boolean consistent = tracked.getStorageLocation() == StorageLocation.REDIS
                    ? tracked.getCacheKey() != null && cached.contains(tracked.getCacheKey())
                    : cataloged.contains(tracked.getRecordKey())
                            && !cached.contains(cacheKey(RecordKey.parse(tracked.getRecordKey())));
            if (!consistent) {
                drifted.add(tracked);
            }
        }
        return drifted;
    }

    private int applyFix(RecordKey key, Double qualityScore, StorageLocation location, Supplier<String> fix) {
        try {
            String applied = withLock(key, "reconciler", fix);
            if (applied == null) {
                return 0;
            }
            log.warn("Reconciled storage drift key={} fix={}", key, applied);
            auditRecorder.recordStorageEvent(key, AuditOutcome.RECONCILED, qualityScore, location.value(), applied);
            return 1;
        } catch (StorageConflictException ex) {
            log.warn("Reconciliation skipped locked key={}", key);
            return 0;
        }
    }

    private String reconcileKey(RecordKey key) {
        StorageTrackingRecord tracking = trackingRepository.findById(key.value()).orElse(null);
        if (tracking == null) {
            return null;
        }
        if (tracking.getStorageLocation() == StorageLocation.REDIS) {
            if (tracking.getCacheKey() == null || !cacheStore.exists(tracking.getCacheKey())) {
                trackingRepository.delete(tracking);
                return "tracked cache entry missing, tracking removed";
            }
            return null;
        }
        if (!catalogStore.exists(key.value())) {
            trackingRepository.delete(tracking);
            return "tracked catalog record missing, tracking removed";
        }
        if (cacheStore.delete(cacheKey(key))) {
            return "cache entry lingering after catalog placement, removed";
        }
        return null;
    }

    private String adoptUntrackedCatalog(RecordKey key) {
        if (trackingRepository.existsById(key.value())) {
            return null;
        }
        Optional<StoredComponent> stored = catalogStore.find(key.value());
        if (stored.isEmpty()) {
            return null;
        }
        StorageTrackingRecord tracking = new StorageTrackingRecord(key.value(), key.mpn(), key.manufacturer());
        tracking.pointToCatalog(stored.get().qualityScore(), stored.get().fingerprint(), "reconciler", clock.instant());
        trackingRepository.save(tracking);
        cacheStore.delete(cacheKey(key));
        return "untracked catalog record adopted";
    }

    private void writeCatalog(RecordKey key, String lineReference, Map<String, Object> fields, double qualityScore,
                              String source, String fingerprint, StorageTrackingRecord existing, String placedBy) {
        Instant now = clock.instant();
        String previousCacheKey = existing != null && existing.getStorageLocation() == StorageLocation.REDIS
                ? existing.getCacheKey()
                : null;
        StorageTrackingRecord tracking = existing != null
                ? existing
                : new StorageTrackingRecord(key.value(), key.mpn(), key.manufacturer());
        transactions.executeWithoutResult(status -> {
            catalogStore.upsert(key, fields, qualityScore, source, fingerprint);
            if (lineReference != null) {
                tracking.setLineReference(lineReference);
            }
            tracking.pointToCatalog(qualityScore, fingerprint, placedBy, now);
            trackingRepository.save(tracking);
        });
        if (previousCacheKey != null) {
            cacheStore.delete(previousCacheKey);
        }
    }

    private void writeCache(PlacementRequest request, String fingerprint, StorageTrackingRecord existing,
                            Duration ttl, String reason, String placedBy) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        RecordKey key = request.key();
        String cacheKey = cacheKey(key);
        CacheEntry entry = new CacheEntry(key.value(), key.mpn(), key.manufacturer(), request.qualityScore(),
                request.fields(), reason, request.canPromote(), request.source(), fingerprint, now, expiresAt);
        cacheStore.put(cacheKey, writeEntry(entry), ttl);
        StorageTrackingRecord tracking = existing != null
                ? existing
                : new StorageTrackingRecord(key.value(), key.mpn(), key.manufacturer());
        try {
            transactions.executeWithoutResult(status -> {
                if (request.lineReference() != null) {
                    tracking.setLineReference(request.lineReference());
                }
                tracking.pointToCache(request.qualityScore(), fingerprint, cacheKey, expiresAt,
                        request.canPromote(), reason, placedBy, now);
                trackingRepository.save(tracking);
            });
        } catch (RuntimeException ex) {
            if (existing == null) {
                cacheStore.delete(cacheKey);
            }
            throw ex;
        }
    }

    private static String cacheReason(PlacementRequest request, EnrichmentPolicy policy) {
        return String.format("quality_score %.2f below catalog threshold %.2f",
                request.qualityScore(), policy.catalogThreshold());
    }

    private boolean presentIn(StorageTrackingRecord tracking) {
        if (tracking.getStorageLocation() == StorageLocation.DATABASE) {
            return catalogStore.exists(tracking.getRecordKey());
        }
        return tracking.getCacheKey() != null && cacheStore.exists(tracking.getCacheKey());
    }

    private <T> T withLock(RecordKey key, String holder, Supplier<T> action) {
        Duration lease = Duration.ofMillis(properties.getLockLeaseMs());
        int attempts = Math.max(1, properties.getLockPollAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (syncLock.acquire(key.value(), holder, lease)) {
                try {
                    return action.get();
                } finally {
                    syncLock.release(key.value(), holder);
                }
            }
            if (attempt < attempts) {
                try {
                    sleeper.sleep(Duration.ofMillis(properties.getLockPollIntervalMs()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.warn("Sync lock unavailable key={} holder={} attempts={}", key, holder, attempts);
        throw new StorageConflictException(key.value(), "Sync lock for " + key + " unavailable after " + attempts + " attempts");
    }

    private PlacementResult count(PlacementResult result) {
        Counter counter = placementCounters.get(result.outcome());
        if (counter != null) {
            counter.increment();
        }
        return result;
    }

    String fingerprint(Map<String, Object> fields) {
        return DigestUtils.sha256Hex(writeJson(new TreeMap<>(fields)));
    }

    private String writeEntry(CacheEntry entry) {
        return writeJson(entry);
    }

    private CacheEntry readEntry(String json) {
        try {
            return objectMapper.readValue(json, CacheEntry.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cache entry is not valid JSON", ex);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize storage payload", ex);
        }
    }

    private static StorageLocation location(Tier tier) {
        return tier == Tier.CATALOG ? StorageLocation.DATABASE : StorageLocation.REDIS;
    }
}
