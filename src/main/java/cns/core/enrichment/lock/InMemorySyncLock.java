package cns.core.enrichment.lock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "cns.enrichment", name = "lock-store", havingValue = "memory")
public class InMemorySyncLock implements SyncLock {

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySyncLock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean acquire(String key, String holder, Duration lease) {
        Instant now = clock.instant();
        Lease requested = new Lease(holder, now.plus(lease));
        Lease current = leases.compute(key, (name, existing) -> {
            if (existing == null || !existing.expiresAt().isAfter(now) || existing.holder().equals(holder)) {
                return requested;
            }
            return existing;
        });
        return current == requested;
    }

    @Override
    public void release(String key, String holder) {
        leases.computeIfPresent(key, (name, existing) -> existing.holder().equals(holder) ? null : existing);
    }

    public boolean isHeld(String key) {
        Lease lease = leases.get(key);
        return lease != null && lease.expiresAt().isAfter(clock.instant());
    }

    private record Lease(String holder, Instant expiresAt) {
    }
}
