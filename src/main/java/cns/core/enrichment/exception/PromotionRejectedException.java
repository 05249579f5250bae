package cns.core.enrichment.exception;

public class PromotionRejectedException extends RuntimeException {

    public PromotionRejectedException(String message) {
        super(message);
    }
}
