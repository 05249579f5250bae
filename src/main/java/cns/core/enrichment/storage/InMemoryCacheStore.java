package cns.core.enrichment.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "cns.enrichment", name = "cache-store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, Stored> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Stored(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<String> get(String key) {
        Stored stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (!stored.expiresAt().isAfter(clock.instant())) {
            entries.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.value());
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public Set<String> existing(Collection<String> keys) {
        return keys.stream().filter(this::exists).collect(Collectors.toSet());
    }

    public int size() {
        return entries.size();
    }

    private record Stored(String value, Instant expiresAt) {
    }
}
