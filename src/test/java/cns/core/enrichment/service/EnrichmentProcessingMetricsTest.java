package cns.core.enrichment.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import cns.core.enrichment.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class EnrichmentProcessingMetricsTest {

    @Test
    void jobsPerMinuteSpansFirstToLastProcessed() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        EnrichmentProcessingMetrics metrics = new EnrichmentProcessingMetrics(clock);

        metrics.recordSuccess(120, false);
        clock.advance(Duration.ofSeconds(30));
        metrics.recordSuccess(80, true);
        clock.advance(Duration.ofSeconds(30));
        metrics.recordError(40);

        assertThat(metrics.getTotalProcessed()).isEqualTo(3);
        assertThat(metrics.getTotalNeedsReview()).isEqualTo(1);
        assertThat(metrics.getTotalProcessingMs()).isEqualTo(240);
        assertThat(metrics.getJobsPerMinute()).isCloseTo(3.0, within(0.001));
    }

    @Test
    void singleInstantWindowReportsZeroRate() {
        EnrichmentProcessingMetrics metrics = new EnrichmentProcessingMetrics(
                MutableClock.startingAt("2024-05-01T10:00:00Z"));

        metrics.recordSuccess(10, false);
        metrics.recordLeasesRecovered(0);

        assertThat(metrics.getJobsPerMinute()).isZero();
        assertThat(metrics.getTotalLeasesRecovered()).isZero();
    }
}
