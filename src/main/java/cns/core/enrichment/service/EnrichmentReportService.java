package cns.core.enrichment.service;

import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.domain.EnrichmentStatus;
import cns.core.enrichment.domain.StorageLocation;
import cns.core.enrichment.repository.AuditRunRepository;
import cns.core.enrichment.repository.EnrichmentRequestRepository;
import cns.core.enrichment.repository.StorageTrackingRepository;
import cns.core.enrichment.resilience.CircuitBreakerRegistry;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EnrichmentReportService {

    private final EnrichmentRequestRepository requestRepository;
    private final StorageTrackingRepository trackingRepository;
    private final AuditRunRepository auditRunRepository;
    private final EnrichmentProcessingMetrics metrics;
    private final SupplierLatencyRecorder latencyRecorder;
    private final CircuitBreakerRegistry breakers;

    public EnrichmentReportService(EnrichmentRequestRepository requestRepository,
                                   StorageTrackingRepository trackingRepository,
                                   AuditRunRepository auditRunRepository,
                                   EnrichmentProcessingMetrics metrics,
                                   SupplierLatencyRecorder latencyRecorder,
                                   CircuitBreakerRegistry breakers) {
        this.requestRepository = requestRepository;
        this.trackingRepository = trackingRepository;
        this.auditRunRepository = auditRunRepository;
        this.metrics = metrics;
        this.latencyRecorder = latencyRecorder;
        this.breakers = breakers;
    }

    @Transactional(readOnly = true)
    public EnrichmentReport report() {
        long totalProcessed = metrics.getTotalProcessed();
        long avgProcessingMs = totalProcessed == 0 ? 0 : metrics.getTotalProcessingMs() / totalProcessed;

        Map<String, Long> outcomes = new TreeMap<>();
        for (Object[] row : auditRunRepository.countByOutcome()) {
            outcomes.put(((AuditOutcome) row[0]).name(), (Long) row[1]);
        }

        return new EnrichmentReport(
                requestRepository.countByStatus(EnrichmentStatus.PENDING),
                requestRepository.countByStatus(EnrichmentStatus.PROCESSING),
                requestRepository.countByStatus(EnrichmentStatus.RETRY_SCHEDULED),
                requestRepository.countByStatus(EnrichmentStatus.SUCCEEDED),
                requestRepository.countByStatus(EnrichmentStatus.FAILED),
                requestRepository.countByStatus(EnrichmentStatus.CANCELLED),
                totalProcessed,
                metrics.getTotalSuccess(),
                metrics.getTotalNeedsReview(),
                metrics.getTotalErrors(),
                metrics.getTotalRetryScheduled(),
                metrics.getTotalConflicts(),
                metrics.getTotalLeasesRecovered(),
                avgProcessingMs,
                metrics.getJobsPerMinute(),
                trackingRepository.countByStorageLocation(StorageLocation.DATABASE),
                trackingRepository.countByStorageLocation(StorageLocation.REDIS),
                outcomes,
                latencyRecorder.snapshot(),
                breakers.snapshots());
    }
}
