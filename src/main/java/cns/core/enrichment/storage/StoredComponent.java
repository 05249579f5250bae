package cns.core.enrichment.storage;

import java.util.Map;

public record StoredComponent(String recordKey, double qualityScore, Map<String, Object> fields, String fingerprint) {
}
