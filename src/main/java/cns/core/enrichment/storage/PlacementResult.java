package cns.core.enrichment.storage;

public record PlacementResult(Tier tier, PlacementOutcome outcome, String reason) {

    public boolean needsReview() {
        return tier == Tier.UNPLACED;
    }
}
