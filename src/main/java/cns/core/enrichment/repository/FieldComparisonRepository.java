package cns.core.enrichment.repository;

import cns.core.enrichment.domain.FieldComparison;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FieldComparisonRepository extends JpaRepository<FieldComparison, UUID> {

    List<FieldComparison> findByAuditRunIdOrderByFieldNameAsc(UUID auditRunId);
}
