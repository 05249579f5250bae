package cns.core.enrichment.exception;

public class SupplierException extends RuntimeException {

    private final String supplierId;
    private final Integer statusCode;
    private final boolean retryable;

    public SupplierException(String supplierId, String message, Integer statusCode, boolean retryable) {
        super(message);
        this.supplierId = supplierId;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public SupplierException(String supplierId, String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.supplierId = supplierId;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public String getSupplierId() {
        return supplierId;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
