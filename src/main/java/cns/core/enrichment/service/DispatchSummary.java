package cns.core.enrichment.service;

public record DispatchSummary(int claimed, int leasesRecovered) {
}
