package cns.core.enrichment.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface CatalogStore {

    void upsert(RecordKey key, Map<String, Object> fields, double qualityScore, String source, String fingerprint);

    Optional<StoredComponent> find(String recordKey);

    boolean exists(String recordKey);

    Set<String> existingKeys(Collection<String> recordKeys);

    /**
     * Record keys in ascending order, strictly after {@code after}.
     */
    List<String> recordKeysAfter(String after, int limit);
}
