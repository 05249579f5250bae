package cns.core.enrichment.service;

public record LatencyStats(
        long count,
        long minNs,
        long maxNs,
        double avgNs,
        long p95Ns,
        long p99Ns) {
}
