package cns.core.enrichment.lock;

import static org.assertj.core.api.Assertions.assertThat;

import cns.core.enrichment.MutableClock;
import cns.core.enrichment.repository.SyncLockRepository;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({JpaSyncLock.class, JpaSyncLockTest.Config.class})
class JpaSyncLockTest {

    private static final Duration LEASE = Duration.ofSeconds(30);

    @TestConfiguration
    static class Config {

        @Bean
        MutableClock clock() {
            return MutableClock.startingAt("2024-05-01T10:00:00Z");
        }
    }

    @Autowired
    private JpaSyncLock lock;

    @Autowired
    private SyncLockRepository repository;

    @Autowired
    private MutableClock clock;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    void secondHolderIsRejectedWhileLeaseIsLive() {
        assertThat(lock.acquire("LM358|TI", "worker-1", LEASE)).isTrue();

        assertThat(lock.acquire("LM358|TI", "worker-2", LEASE)).isFalse();
        assertThat(repository.findById("LM358|TI").orElseThrow().getLockedBy()).isEqualTo("worker-1");
    }

    @Test
    void holderCanRenewItsLease() {
        lock.acquire("LM358|TI", "worker-1", LEASE);
        clock.advance(Duration.ofSeconds(10));

        assertThat(lock.acquire("LM358|TI", "worker-1", LEASE)).isTrue();
        assertThat(repository.findById("LM358|TI").orElseThrow().getExpiresAt())
                .isEqualTo(clock.instant().plus(LEASE));
    }

    @Test
    void releaseFreesKeyForNextHolder() {
        lock.acquire("LM358|TI", "worker-1", LEASE);

        lock.release("LM358|TI", "worker-1");

        assertThat(repository.existsById("LM358|TI")).isFalse();
        assertThat(lock.acquire("LM358|TI", "worker-2", LEASE)).isTrue();
    }

    @Test
    void releaseByOtherHolderLeavesLeaseInPlace() {
        lock.acquire("LM358|TI", "worker-1", LEASE);

        lock.release("LM358|TI", "worker-2");

        assertThat(lock.acquire("LM358|TI", "worker-2", LEASE)).isFalse();
    }

    @Test
    void expiredLeaseIsTakenOver() {
        lock.acquire("LM358|TI", "worker-1", LEASE);
        clock.advance(LEASE);

        assertThat(lock.acquire("LM358|TI", "worker-2", LEASE)).isTrue();
        assertThat(repository.findById("LM358|TI").orElseThrow().getLockedBy()).isEqualTo("worker-2");
    }
}
