package cns.core.enrichment.resilience;

@FunctionalInterface
public interface SupplierCall<T> {

    T call();
}
