package cns.core.enrichment.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class EnrichmentProcessingMetrics {

    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalSuccess = new AtomicLong();
    private final AtomicLong totalNeedsReview = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicLong totalRetryScheduled = new AtomicLong();
    private final AtomicLong totalConflicts = new AtomicLong();
    private final AtomicLong totalCancelled = new AtomicLong();
    private final AtomicLong totalLeasesRecovered = new AtomicLong();
    private final AtomicLong totalProcessingMs = new AtomicLong();
    private final AtomicReference<Instant> firstProcessedAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastProcessedAt = new AtomicReference<>();
    private final Clock clock;

    public EnrichmentProcessingMetrics(Clock clock) {
        this.clock = clock;
    }

    public void recordSuccess(long processingMs, boolean needsReview) {
        totalProcessed.incrementAndGet();
        totalSuccess.incrementAndGet();
        if (needsReview) {
            totalNeedsReview.incrementAndGet();
        }
        totalProcessingMs.addAndGet(processingMs);
        updateProcessedWindow();
    }

    public void recordError(long processingMs) {
        totalProcessed.incrementAndGet();
        totalErrors.incrementAndGet();
        totalProcessingMs.addAndGet(processingMs);
        updateProcessedWindow();
    }

    public void recordRetry() {
        totalRetryScheduled.incrementAndGet();
    }

    public void recordConflict() {
        totalConflicts.incrementAndGet();
    }

    public void recordCancelled() {
        totalCancelled.incrementAndGet();
    }

    public void recordLeasesRecovered(int recovered) {
        if (recovered > 0) {
            totalLeasesRecovered.addAndGet(recovered);
        }
    }

    public long getTotalProcessed() {
        return totalProcessed.get();
    }

    public long getTotalSuccess() {
        return totalSuccess.get();
    }

    public long getTotalNeedsReview() {
        return totalNeedsReview.get();
    }

    public long getTotalErrors() {
        return totalErrors.get();
    }

    public long getTotalRetryScheduled() {
        return totalRetryScheduled.get();
    }

    public long getTotalConflicts() {
        return totalConflicts.get();
    }

    public long getTotalCancelled() {
        return totalCancelled.get();
    }

    public long getTotalLeasesRecovered() {
        return totalLeasesRecovered.get();
    }

    public long getTotalProcessingMs() {
        return totalProcessingMs.get();
    }

    public double getJobsPerMinute() {
        Instant start = firstProcessedAt.get();
        Instant end = lastProcessedAt.get();
        if (start == null || end == null) {
            return 0.0;
        }
        long seconds = Duration.between(start, end).getSeconds();
        if (seconds == 0) {
            return 0.0;
        }
        return totalProcessed.get() / (seconds / 60.0);
    }

    private void updateProcessedWindow() {
        Instant now = clock.instant();
        firstProcessedAt.compareAndSet(null, now);
        lastProcessedAt.set(now);
    }
}
