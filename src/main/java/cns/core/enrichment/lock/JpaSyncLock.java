package cns.core.enrichment.lock;

import cns.core.enrichment.domain.SyncLockLease;
import cns.core.enrichment.repository.SyncLockRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

@Component
@ConditionalOnProperty(prefix = "cns.enrichment", name = "lock-store", havingValue = "jpa", matchIfMissing = true)
public class JpaSyncLock implements SyncLock {

    private static final Logger log = LoggerFactory.getLogger(JpaSyncLock.class);
    private final SyncLockRepository repository;
    private final TransactionOperations transactions;
    private final Clock clock;

    public JpaSyncLock(SyncLockRepository repository, TransactionOperations transactions, Clock clock) {
        this.repository = repository;
        this.transactions = transactions;
        this.clock = clock;
    }

    @Override
    public boolean acquire(String key, String holder, Duration lease) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(lease);
        if (repository.takeOver(key, holder, now, expiresAt) == 1) {
            return true;
        }
        try {
            transactions.executeWithoutResult(status ->
                    repository.saveAndFlush(new SyncLockLease(key, holder, now, expiresAt)));
            return true;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Lock held elsewhere key={} holder={}", key, holder);
            return false;
        }
    }

    @Override
    public void release(String key, String holder) {
        int released = repository.release(key, holder);
        if (released == 0) {
            log.warn("Lock release found no lease key={} holder={}", key, holder);
        }
    }
}
