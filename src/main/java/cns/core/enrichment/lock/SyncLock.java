package cns.core.enrichment.lock;

import java.time.Duration;

/**
 * Cross-process mutual exclusion keyed by record. A lease that is not released expires
 * on its own so a crashed holder cannot block a key forever.
 */
public interface SyncLock {

    boolean acquire(String key, String holder, Duration lease);

    void release(String key, String holder);
}
