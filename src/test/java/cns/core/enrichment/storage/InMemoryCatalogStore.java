package cns.core.enrichment.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

class InMemoryCatalogStore implements CatalogStore {

    private final Map<String, StoredComponent> records = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public void upsert(RecordKey key, Map<String, Object> fields, double qualityScore, String source, String fingerprint) {
        writes.incrementAndGet();
        records.put(key.value(), new StoredComponent(key.value(), qualityScore, Map.copyOf(fields), fingerprint));
    }

    @Override
    public Optional<StoredComponent> find(String recordKey) {
        return Optional.ofNullable(records.get(recordKey));
    }

    @Override
    public boolean exists(String recordKey) {
        return records.containsKey(recordKey);
    }

    @Override
    public Set<String> existingKeys(Collection<String> recordKeys) {
        return recordKeys.stream().filter(records::containsKey).collect(Collectors.toSet());
    }

    @Override
    public List<String> recordKeysAfter(String after, int limit) {
        return records.keySet().stream()
                .filter(key -> key.compareTo(after) > 0)
                .sorted()
                .limit(limit)
                .toList();
    }

    int writes() {
        return writes.get();
    }
}
