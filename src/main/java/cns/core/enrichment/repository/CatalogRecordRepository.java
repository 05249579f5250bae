package cns.core.enrichment.repository;

import cns.core.enrichment.domain.CatalogRecord;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CatalogRecordRepository extends JpaRepository<CatalogRecord, UUID> {

    Optional<CatalogRecord> findByRecordKey(String recordKey);

    @Query("select c.recordKey from CatalogRecord c where c.recordKey > :after order by c.recordKey asc")
    List<String> findRecordKeysAfter(@Param("after") String after, Pageable pageable);

    @Query("select c.recordKey from CatalogRecord c where c.recordKey in :keys")
    List<String> findExistingRecordKeys(@Param("keys") Collection<String> keys);
}
