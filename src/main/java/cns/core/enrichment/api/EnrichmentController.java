package cns.core.enrichment.api;

import cns.core.enrichment.domain.EnrichmentRequest;
import cns.core.enrichment.domain.EnrichmentStatus;
import cns.core.enrichment.domain.RequestSource;
import cns.core.enrichment.dto.BatchJobView;
import cns.core.enrichment.dto.BatchSubmission;
import cns.core.enrichment.dto.EnrichmentRequestView;
import cns.core.enrichment.dto.SubmitRequest;
import cns.core.enrichment.queue.EnrichmentQueue;
import cns.core.enrichment.queue.NewEnrichmentRequest;
import cns.core.enrichment.repository.EnrichmentRequestRepository;
import cns.core.enrichment.service.BatchJobService;
import cns.core.enrichment.service.DispatchSummary;
import cns.core.enrichment.service.EnrichmentDispatchService;
import cns.core.enrichment.service.EnrichmentReport;
import cns.core.enrichment.service.EnrichmentReportService;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/enrichment")
public class EnrichmentController {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentController.class);
    private static final int DEFAULT_PRIORITY = 5;

    private final EnrichmentQueue queue;
    private final EnrichmentRequestRepository requestRepository;
    private final BatchJobService batchJobService;
    private final EnrichmentDispatchService dispatchService;
    private final EnrichmentReportService reportService;

    public EnrichmentController(EnrichmentQueue queue,
                                EnrichmentRequestRepository requestRepository,
                                BatchJobService batchJobService,
                                EnrichmentDispatchService dispatchService,
                                EnrichmentReportService reportService) {
        this.queue = queue;
        this.requestRepository = requestRepository;
        this.batchJobService = batchJobService;
        this.dispatchService = dispatchService;
        this.reportService = reportService;
    }

    @PostMapping("/requests")
    public ResponseEntity<EnrichmentRequestView> submit(@RequestBody SubmitRequest body) {
        requireText(body.mpn(), "mpn");
        requireText(body.organizationId(), "organizationId");
        log.info("Submitting enrichment request mpn={} organizationId={}", body.mpn(), body.organizationId());
        EnrichmentRequest request = queue.enqueue(new NewEnrichmentRequest(body.mpn(), body.manufacturer(),
                priority(body.priority()), source(body.source(), RequestSource.MANUAL), body.organizationId(), null,
                body.lineReference()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(EnrichmentRequestView.from(request));
    }

    @PostMapping("/batches")
    public ResponseEntity<BatchJobView> submitBatch(@RequestBody BatchSubmission body) {
        requireText(body.organizationId(), "organizationId");
        if (body.items() == null || body.items().isEmpty()) {
            throw new IllegalArgumentException("items must not be empty");
        }
        List<BatchJobService.BatchItem> items = body.items().stream()
                .map(item -> {
                    requireText(item.mpn(), "items[].mpn");
                    return new BatchJobService.BatchItem(item.mpn(), item.manufacturer(), priority(item.priority()),
                            item.lineReference());
                })
                .toList();
        log.info("Submitting batch organizationId={} items={}", body.organizationId(), items.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(BatchJobView.from(batchJobService.create(
                body.organizationId(), body.label(), source(body.source(), RequestSource.BOM_UPLOAD), items)));
    }

    @GetMapping("/batches/{id}")
    public ResponseEntity<BatchJobView> batch(@PathVariable UUID id) {
        return ResponseEntity.ok(BatchJobView.from(batchJobService.get(id)));
    }

    @PostMapping("/batches/{id}/cancel")
    public ResponseEntity<BatchJobView> cancelBatch(@PathVariable UUID id) {
        log.info("Cancelling batch batchJobId={}", id);
        return ResponseEntity.ok(BatchJobView.from(batchJobService.cancel(id)));
    }

    @GetMapping("/requests")
    public ResponseEntity<List<EnrichmentRequestView>> requests(@RequestParam(required = false) EnrichmentStatus status,
                                                                @RequestParam(defaultValue = "50") int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<EnrichmentRequest> requests = status == null
                ? requestRepository.findAllByOrderByCreatedAtDesc(page)
                : requestRepository.findByStatusOrderByCreatedAtDesc(status, page);
        return ResponseEntity.ok(requests.stream().map(EnrichmentRequestView::from).toList());
    }

    @PostMapping("/dispatch")
    public ResponseEntity<DispatchSummary> dispatch() {
        log.info("Manual dispatch requested");
        return ResponseEntity.ok(dispatchService.dispatchPending());
    }

    @GetMapping("/report")
    public ResponseEntity<EnrichmentReport> report() {
        return ResponseEntity.ok(reportService.report());
    }

    private static int priority(Integer priority) {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }

    private static RequestSource source(RequestSource source, RequestSource fallback) {
        return source == null ? fallback : source;
    }

    static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
