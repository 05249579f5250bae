package cns.core.enrichment.service;

import cns.core.enrichment.audit.SupplierAttempt;
import cns.core.enrichment.exception.ExhaustionException;
import cns.core.enrichment.supplier.SupplierLookup;
import java.util.List;
import java.util.stream.Collectors;

public record DispatchResult(
        SupplierLookup lookup,
        double matchConfidence,
        List<SupplierAttempt> attempts,
        List<SupplierLookup> responses) {

    public DispatchResult {
        attempts = List.copyOf(attempts);
        responses = List.copyOf(responses);
    }

    public boolean usable() {
        return lookup != null;
    }

    public SupplierLookup requireUsable() {
        if (lookup == null) {
            throw new ExhaustionException(describeAttempts(),
                    attempts.stream().map(SupplierAttempt::supplierId).toList());
        }
        return lookup;
    }

    /**
     * Failures, skips and recovered errors met on the way to the answer, or {@code null} when
     * every supplier consulted answered cleanly.
     */
    public String supplierErrors() {
        List<SupplierAttempt> troubled = attempts.stream().filter(SupplierAttempt::hasError).toList();
        if (troubled.isEmpty()) {
            return null;
        }
        return troubled.stream().map(DispatchResult::describe).collect(Collectors.joining(", "));
    }

    private String describeAttempts() {
        if (attempts.isEmpty()) {
            return "All suppliers exhausted: no supplier enabled";
        }
        return attempts.stream()
                .map(DispatchResult::describe)
                .collect(Collectors.joining(", ", "All suppliers exhausted: ", ""));
    }

    private static String describe(SupplierAttempt attempt) {
        return attempt.supplierId() + "=" + attempt.result()
                + (attempt.error() == null ? "" : " (" + attempt.error() + ")");
    }
}
