package cns.core.enrichment.supplier;

import cns.core.enrichment.policy.EnrichmentPolicy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class SupplierRegistry {

    private final Map<String, SupplierAdapter> adapters = new LinkedHashMap<>();

    public SupplierRegistry(List<? extends SupplierAdapter> adapters) {
        for (SupplierAdapter adapter : adapters) {
            if (this.adapters.putIfAbsent(adapter.id(), adapter) != null) {
                throw new IllegalStateException("Duplicate supplier id " + adapter.id());
            }
        }
    }

    /**
     * Suppliers named in the policy's priority list first, in that order, then every other
     * registered supplier in registration order. Disabled suppliers are left out.
     */
    public List<SupplierAdapter> ordered(EnrichmentPolicy policy) {
        List<SupplierAdapter> ordered = new ArrayList<>();
        for (String id : policy.supplierPriority()) {
            SupplierAdapter adapter = adapters.get(id);
            if (adapter != null && !ordered.contains(adapter)) {
                ordered.add(adapter);
            }
        }
        for (SupplierAdapter adapter : adapters.values()) {
            if (!ordered.contains(adapter)) {
                ordered.add(adapter);
            }
        }
        ordered.removeIf(adapter -> !policy.supplierEnabled(adapter.id()));
        return List.copyOf(ordered);
    }

    public Optional<SupplierAdapter> find(String supplierId) {
        return Optional.ofNullable(adapters.get(supplierId));
    }

    public Set<String> ids() {
        return Set.copyOf(adapters.keySet());
    }
}
