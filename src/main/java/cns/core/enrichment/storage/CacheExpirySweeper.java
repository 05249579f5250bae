package cns.core.enrichment.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CacheExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheExpirySweeper.class);
    private final StorageRouter storageRouter;

    public CacheExpirySweeper(StorageRouter storageRouter) {
        this.storageRouter = storageRouter;
    }

    @Scheduled(fixedDelayString = "${cns.enrichment.expiry-sweep-delay-ms:60000}")
    public void scheduledSweep() {
        log.debug("Expiry sweep tick");
        sweep();
    }

    public SweepSummary sweep() {
        int expired = storageRouter.sweepExpired();
        int reconciled = storageRouter.reconcile();
        return new SweepSummary(expired, reconciled);
    }

    public record SweepSummary(int expired, int reconciled) {
    }
}
