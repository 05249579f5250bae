package cns.core.enrichment.exception;

public class TransientSupplierException extends SupplierException {

    public TransientSupplierException(String supplierId, String message, Integer statusCode) {
        super(supplierId, message, statusCode, true);
    }

    public TransientSupplierException(String supplierId, String message, Throwable cause) {
        super(supplierId, message, null, true, cause);
    }
}
