package cns.core.enrichment.exception;

import java.util.List;

public class ExhaustionException extends RuntimeException {

    private final List<String> attemptedSuppliers;

    public ExhaustionException(String message, List<String> attemptedSuppliers) {
        super(message);
        this.attemptedSuppliers = List.copyOf(attemptedSuppliers);
    }

    public List<String> getAttemptedSuppliers() {
        return attemptedSuppliers;
    }
}
