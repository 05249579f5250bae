package cns.core.enrichment.api;

import cns.core.enrichment.dto.PromoteRequest;
import cns.core.enrichment.dto.StorageTrackingView;
import cns.core.enrichment.exception.ResourceNotFoundException;
import cns.core.enrichment.storage.CacheExpirySweeper;
import cns.core.enrichment.storage.PlacementResult;
import cns.core.enrichment.storage.RecordKey;
import cns.core.enrichment.storage.StorageRouter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/storage")
public class StorageController {

    private static final Logger log = LoggerFactory.getLogger(StorageController.class);
    private final StorageRouter storageRouter;
    private final CacheExpirySweeper sweeper;

    public StorageController(StorageRouter storageRouter, CacheExpirySweeper sweeper) {
        this.storageRouter = storageRouter;
        this.sweeper = sweeper;
    }

    @GetMapping("/tracking")
    public ResponseEntity<StorageTrackingView> tracking(@RequestParam String mpn,
                                                        @RequestParam(required = false) String manufacturer) {
        RecordKey key = RecordKey.of(mpn, manufacturer);
        return storageRouter.tracking(key)
                .map(StorageTrackingView::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("No storage tracking for " + key));
    }

    @GetMapping("/tracking/cache")
    public ResponseEntity<List<StorageTrackingView>> cacheEntries(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(storageRouter.cacheEntries(limit).stream().map(StorageTrackingView::from).toList());
    }

    @PostMapping("/promote")
    public ResponseEntity<PlacementResult> promote(@RequestBody PromoteRequest body) {
        EnrichmentController.requireText(body.mpn(), "mpn");
        EnrichmentController.requireText(body.operator(), "operator");
        log.info("Manual promotion requested mpn={} manufacturer={} operator={}",
                body.mpn(), body.manufacturer(), body.operator());
        return ResponseEntity.ok(storageRouter.promote(RecordKey.of(body.mpn(), body.manufacturer()), body.operator()));
    }

    @PostMapping("/sweep")
    public ResponseEntity<CacheExpirySweeper.SweepSummary> sweep() {
        log.info("Manual expiry sweep requested");
        return ResponseEntity.ok(sweeper.sweep());
    }
}
