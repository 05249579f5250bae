package cns.core.enrichment.quality;

import cns.core.enrichment.domain.DataQuality;
import cns.core.enrichment.domain.FieldStatus;

public record FieldDiff(
        String field,
        String supplierValue,
        String storedValue,
        String normalizedValue,
        FieldStatus status,
        String changeReason,
        double confidence,
        DataQuality sourceDataQuality) {

    public boolean present() {
        return status == FieldStatus.CHANGED || status == FieldStatus.UNCHANGED;
    }
}
