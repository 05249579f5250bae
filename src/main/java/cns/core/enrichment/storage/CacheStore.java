package cns.core.enrichment.storage;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Expiring key/value tier. {@code put} must set value and expiry atomically.
 */
public interface CacheStore {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    boolean delete(String key);

    boolean exists(String key);

    Set<String> existing(Collection<String> keys);
}
