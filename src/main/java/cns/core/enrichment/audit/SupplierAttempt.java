package cns.core.enrichment.audit;

public record SupplierAttempt(
        String supplierId,
        Result result,
        int calls,
        long backoffMs,
        String error) {

    public enum Result {
        FOUND,
        NOT_FOUND,
        NO_MATCH,
        FAILED,
        ABANDONED,
        SKIPPED_CIRCUIT_OPEN,
        SKIPPED_QUOTA
    }

    public boolean hasError() {
        return error != null || result == Result.FAILED || result == Result.ABANDONED
                || result == Result.SKIPPED_CIRCUIT_OPEN || result == Result.SKIPPED_QUOTA;
    }

    public static SupplierAttempt skipped(String supplierId, Result result) {
        return new SupplierAttempt(supplierId, result, 0, 0L, null);
    }
}
