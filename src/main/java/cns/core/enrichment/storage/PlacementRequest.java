package cns.core.enrichment.storage;

import java.util.Map;

public record PlacementRequest(
        RecordKey key,
        String lineReference,
        double qualityScore,
        Map<String, Object> fields,
        boolean canPromote,
        String source) {

    public PlacementRequest {
        fields = Map.copyOf(fields);
    }
}
