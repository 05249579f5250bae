package cns.core.enrichment.supplier;

import java.util.Map;

public record SupplierLookup(
        String supplierId,
        boolean found,
        String returnedMpn,
        String returnedManufacturer,
        double confidence,
        Map<String, Object> fields,
        Map<String, Double> fieldConfidence,
        String rawPayload) {

    public SupplierLookup {
        fields = fields == null ? Map.of() : fields;
        fieldConfidence = fieldConfidence == null ? Map.of() : fieldConfidence;
    }

    public static SupplierLookup notFound(String supplierId, String rawPayload) {
        return new SupplierLookup(supplierId, false, null, null, 0.0, Map.of(), Map.of(), rawPayload);
    }

    public boolean hasPayload() {
        return found && !fields.isEmpty();
    }
}
