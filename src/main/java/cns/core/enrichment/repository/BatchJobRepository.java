package cns.core.enrichment.repository;

import cns.core.enrichment.domain.BatchJob;
import cns.core.enrichment.domain.BatchJobStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface BatchJobRepository extends JpaRepository<BatchJob, UUID> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BatchJob b set b.status = :running, b.startedAt = :now where b.id = :id and b.status = :pending")
    int markRunning(@Param("id") UUID id,
                    @Param("pending") BatchJobStatus pending,
                    @Param("running") BatchJobStatus running,
                    @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BatchJob b set b.processedItems = b.processedItems + 1, b.successfulItems = b.successfulItems + :successDelta, b.failedItems = b.failedItems + :failedDelta where b.id = :id")
    int recordItem(@Param("id") UUID id,
                   @Param("successDelta") int successDelta,
                   @Param("failedDelta") int failedDelta);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BatchJob b set b.status = :completed, b.completedAt = :now where b.id = :id and b.status in :open and b.processedItems >= b.totalItems and b.failedItems = 0")
    int completeClean(@Param("id") UUID id,
                      @Param("completed") BatchJobStatus completed,
                      @Param("open") Collection<BatchJobStatus> open,
                      @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BatchJob b set b.status = :completedWithErrors, b.completedAt = :now where b.id = :id and b.status in :open and b.processedItems >= b.totalItems and b.failedItems > 0")
    int completeWithErrors(@Param("id") UUID id,
                           @Param("completedWithErrors") BatchJobStatus completedWithErrors,
                           @Param("open") Collection<BatchJobStatus> open,
                           @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BatchJob b set b.status = :cancelled, b.completedAt = :now where b.id = :id and b.status in :open")
    int cancel(@Param("id") UUID id,
               @Param("cancelled") BatchJobStatus cancelled,
               @Param("open") Collection<BatchJobStatus> open,
               @Param("now") Instant now);
}
