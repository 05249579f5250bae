package cns.core.enrichment.resilience;

import cns.core.enrichment.exception.SupplierException;

public record RetryResult<T>(
        T value,
        SupplierException failure,
        int attempts,
        long backoffMs,
        boolean abandoned,
        SupplierException recoveredFrom) {

    static <T> RetryResult<T> success(T value, int attempts, long backoffMs, SupplierException recoveredFrom) {
        return new RetryResult<>(value, null, attempts, backoffMs, false, recoveredFrom);
    }

    static <T> RetryResult<T> failure(SupplierException failure, int attempts, long backoffMs, boolean abandoned) {
        return new RetryResult<>(null, failure, attempts, backoffMs, abandoned, null);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
