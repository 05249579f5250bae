package cns.core.enrichment.api;

import cns.core.enrichment.audit.AuditRecorder;
import cns.core.enrichment.domain.AuditRun;
import cns.core.enrichment.dto.AuditRunView;
import cns.core.enrichment.dto.FieldComparisonView;
import cns.core.enrichment.dto.ReviewRequest;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditRecorder auditRecorder;

    public AuditController(AuditRecorder auditRecorder) {
        this.auditRecorder = auditRecorder;
    }

    @GetMapping("/runs")
    public ResponseEntity<List<AuditRunView>> runs(@RequestParam(required = false) UUID requestId,
                                                   @RequestParam(defaultValue = "50") int limit) {
        List<AuditRun> runs = requestId == null
                ? auditRecorder.recentRuns(limit)
                : auditRecorder.runsForRequest(requestId);
        return ResponseEntity.ok(runs.stream().map(AuditRunView::from).toList());
    }

    @GetMapping("/runs/{id}/comparisons")
    public ResponseEntity<List<FieldComparisonView>> comparisons(@PathVariable UUID id) {
        return ResponseEntity.ok(auditRecorder.comparisons(id).stream().map(FieldComparisonView::from).toList());
    }

    @PostMapping("/runs/{id}/review")
    public ResponseEntity<AuditRunView> review(@PathVariable UUID id, @RequestBody ReviewRequest body) {
        if (body.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        EnrichmentController.requireText(body.reviewer(), "reviewer");
        return ResponseEntity.ok(AuditRunView.from(
                auditRecorder.review(id, body.status(), body.reviewer(), body.note())));
    }
}
