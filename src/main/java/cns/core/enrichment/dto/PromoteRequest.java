package cns.core.enrichment.dto;

public record PromoteRequest(String mpn, String manufacturer, String operator) {
}
