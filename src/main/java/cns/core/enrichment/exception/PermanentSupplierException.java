package cns.core.enrichment.exception;

public class PermanentSupplierException extends SupplierException {

    public PermanentSupplierException(String supplierId, String message, Integer statusCode) {
        super(supplierId, message, statusCode, false);
    }

    public PermanentSupplierException(String supplierId, String message, Throwable cause) {
        super(supplierId, message, null, false, cause);
    }
}
