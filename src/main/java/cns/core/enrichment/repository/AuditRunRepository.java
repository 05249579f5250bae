package cns.core.enrichment.repository;

import cns.core.enrichment.domain.AuditRun;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface AuditRunRepository extends JpaRepository<AuditRun, UUID> {

    List<AuditRun> findByRequestIdOrderByStartedAtAsc(UUID requestId);

    List<AuditRun> findByRecordKeyOrderByStartedAtDesc(String recordKey, Pageable pageable);

    List<AuditRun> findAllByOrderByStartedAtDesc(Pageable pageable);

    @Query("select a.outcome, count(a) from AuditRun a group by a.outcome")
    List<Object[]> countByOutcome();
}
