package cns.core.enrichment.repository;

import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.EnrichmentStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface EnrichmentRequestRepository extends JpaRepository<EnrichmentRequest, UUID> {

    @Query("select r from EnrichmentRequest r where (r.status = :pending) or (r.status = :retry and r.nextAttemptAt <= :now) order by r.priority desc, r.createdAt asc")
    List<EnrichmentRequest> findClaimable(@Param("pending") EnrichmentStatus pending,
                                          @Param("retry") EnrichmentStatus retry,
                                          @Param("now") Instant now,
                                          Pageable pageable);

    List<EnrichmentRequest> findByStatusOrderByCreatedAtDesc(EnrichmentStatus status, Pageable pageable);

    List<EnrichmentRequest> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<EnrichmentRequest> findByBatchJobId(UUID batchJobId);

    long countByStatus(EnrichmentStatus status);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :processing, r.startedAt = :now, r.lastAttemptAt = :now, r.attemptCount = r.attemptCount + 1, r.completedAt = null, r.nextAttemptAt = null where r.id = :id and r.status in :claimable")
    int claim(@Param("id") UUID id,
              @Param("processing") EnrichmentStatus processing,
              @Param("now") Instant now,
              @Param("claimable") Collection<EnrichmentStatus> claimable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :succeeded, r.completedAt = :now, r.qualityScore = :score, r.tier = :tier, r.needsReview = :needsReview, r.errorMessage = null where r.id = :id and r.status = :processing and r.attemptCount = :attempt")
    int markSucceeded(@Param("id") UUID id,
                      @Param("attempt") int attempt,
                      @Param("succeeded") EnrichmentStatus succeeded,
                      @Param("processing") EnrichmentStatus processing,
                      @Param("now") Instant now,
                      @Param("score") Double score,
                      @Param("tier") String tier,
                      @Param("needsReview") boolean needsReview);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :failed, r.completedAt = :now, r.errorMessage = :errorMessage where r.id = :id and r.status = :processing and r.attemptCount = :attempt")
    int markFailed(@Param("id") UUID id,
                   @Param("attempt") int attempt,
                   @Param("failed") EnrichmentStatus failed,
                   @Param("processing") EnrichmentStatus processing,
                   @Param("now") Instant now,
                   @Param("errorMessage") String errorMessage);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :retryStatus, r.startedAt = null, r.nextAttemptAt = :nextAttemptAt, r.errorMessage = :errorMessage where r.id = :id and r.status = :processing and r.attemptCount = :attempt")
    int scheduleRetry(@Param("id") UUID id,
                      @Param("attempt") int attempt,
                      @Param("retryStatus") EnrichmentStatus retryStatus,
                      @Param("processing") EnrichmentStatus processing,
                      @Param("nextAttemptAt") Instant nextAttemptAt,
                      @Param("errorMessage") String errorMessage);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :pending, r.startedAt = null, r.attemptCount = r.attemptCount - 1 where r.id = :id and r.status = :processing and r.attemptCount = :attempt")
    int release(@Param("id") UUID id,
                @Param("attempt") int attempt,
                @Param("pending") EnrichmentStatus pending,
                @Param("processing") EnrichmentStatus processing);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :cancelled, r.completedAt = :now where r.id = :id and r.status in :cancellable")
    int markCancelled(@Param("id") UUID id,
                      @Param("cancelled") EnrichmentStatus cancelled,
                      @Param("now") Instant now,
                      @Param("cancellable") Collection<EnrichmentStatus> cancellable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :cancelled, r.completedAt = :now where r.batchJobId = :batchJobId and r.status in :cancellable")
    int cancelQueuedForBatch(@Param("batchJobId") UUID batchJobId,
                             @Param("cancelled") EnrichmentStatus cancelled,
                             @Param("now") Instant now,
                             @Param("cancellable") Collection<EnrichmentStatus> cancellable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EnrichmentRequest r set r.status = :retryStatus, r.startedAt = null, r.completedAt = null, r.nextAttemptAt = :now, r.errorMessage = :errorMessage where r.status = :processing and r.startedAt <= :cutoff")
    int recoverStuck(@Param("processing") EnrichmentStatus processing,
                     @Param("retryStatus") EnrichmentStatus retryStatus,
                     @Param("cutoff") Instant cutoff,
                     @Param("now") Instant now,
                     @Param("errorMessage") String errorMessage);

    @Query("select r from EnrichmentRequest r where r.status = :processing and r.startedAt <= :cutoff and r.attemptCount >= :maxAttempts")
    List<EnrichmentRequest> findStuckExhausted(@Param("processing") EnrichmentStatus processing,
                                               @Param("cutoff") Instant cutoff,
                                               @Param("maxAttempts") int maxAttempts);
}
