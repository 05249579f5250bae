package cns.core.enrichment.repository;

import cns.core.enrichment.domain.SyncLockLease;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface SyncLockRepository extends JpaRepository<SyncLockLease, String> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update SyncLockLease l set l.lockedBy = :holder, l.lockedAt = :now, l.expiresAt = :expiresAt where l.lockName = :name and (l.expiresAt <= :now or l.lockedBy = :holder)")
    int takeOver(@Param("name") String name,
                 @Param("holder") String holder,
                 @Param("now") Instant now,
                 @Param("expiresAt") Instant expiresAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from SyncLockLease l where l.lockName = :name and l.lockedBy = :holder")
    int release(@Param("name") String name, @Param("holder") String holder);
}
