package cns.core.enrichment.service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.HdrHistogram.ConcurrentHistogram;
import org.springframework.stereotype.Component;

@Component
public class SupplierLatencyRecorder {

    private static final long HIGHEST_TRACKABLE_NS = TimeUnit.MINUTES.toNanos(5);
    private static final int SIGNIFICANT_DIGITS = 3;

    private final Map<String, ConcurrentHistogram> histograms = new ConcurrentHashMap<>();

    public void record(String supplierId, long durationNs) {
        if (durationNs <= 0L) {
            return;
        }
        histograms.computeIfAbsent(supplierId,
                        id -> new ConcurrentHistogram(HIGHEST_TRACKABLE_NS, SIGNIFICANT_DIGITS))
                .recordValue(Math.min(durationNs, HIGHEST_TRACKABLE_NS));
    }

    public Map<String, LatencyStats> snapshot() {
        Map<String, LatencyStats> stats = new TreeMap<>();
        histograms.forEach((supplierId, histogram) -> {
            ConcurrentHistogram copy;
            synchronized (histogram) {
                copy = histogram.copy();
            }
            long count = copy.getTotalCount();
            stats.put(supplierId, new LatencyStats(
                    count,
                    count == 0 ? 0L : copy.getMinValue(),
                    count == 0 ? 0L : copy.getMaxValue(),
                    count == 0 ? 0.0 : copy.getMean(),
                    count == 0 ? 0L : copy.getValueAtPercentile(95.0),
                    count == 0 ? 0L : copy.getValueAtPercentile(99.0)));
        });
        return stats;
    }
}
