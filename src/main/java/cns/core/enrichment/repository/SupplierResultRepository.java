package cns.core.enrichment.repository;

import cns.core.enrichment.domain.SupplierResult;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SupplierResultRepository extends JpaRepository<SupplierResult, UUID> {

    List<SupplierResult> findByRequestIdOrderByFetchedAtAsc(UUID requestId);
}
