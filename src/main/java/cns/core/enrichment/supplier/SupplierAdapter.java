package cns.core.enrichment.supplier;

/**
 * One external part-data source. Implementations translate transport failures into
 * {@link cns.core.enrichment.exception.TransientSupplierException} or
 * {@link cns.core.enrichment.exception.PermanentSupplierException} and report a part the
 * supplier does not carry as a lookup with {@code found == false}.
 */
public interface SupplierAdapter {

    String id();

    SupplierLookup lookup(String mpn, String manufacturer);

    default int maxRequestsPerHour() {
        return Integer.MAX_VALUE;
    }
}
