package cns.core.enrichment.repository;

import cns.core.enrichment.domain.StorageLocation;
import cns.core.enrichment.domain.StorageTrackingRecord;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StorageTrackingRepository extends JpaRepository<StorageTrackingRecord, String> {

    List<StorageTrackingRecord> findByStorageLocationAndExpiresAtLessThanEqual(StorageLocation location,
                                                                               Instant cutoff,
                                                                               Pageable pageable);

    List<StorageTrackingRecord> findByStorageLocationOrderByUpdatedAtDesc(StorageLocation location, Pageable pageable);

    List<StorageTrackingRecord> findByRecordKeyGreaterThanOrderByRecordKeyAsc(String after, Pageable pageable);

    List<StorageTrackingRecord> findByStorageLocation(StorageLocation location);

    long countByStorageLocation(StorageLocation location);
}
