package cns.core.enrichment.dto;

import cns.core.enrichment.domain.DataQuality;
import cns.core.enrichment.domain.FieldComparison;
import cns.core.enrichment.domain.FieldStatus;

public record FieldComparisonView(String field,
                                  String supplierValue,
                                  String storedValue,
                                  String normalizedValue,
                                  FieldStatus status,
                                  String changeReason,
                                  double confidence,
                                  DataQuality sourceDataQuality) {
    public static FieldComparisonView from(FieldComparison comparison) {
        return new FieldComparisonView(comparison.getFieldName(), comparison.getSupplierValue(),
                comparison.getStoredValue(), comparison.getNormalizedValue(), comparison.getStatus(),
                comparison.getChangeReason(), comparison.getConfidence(), comparison.getSourceDataQuality());
    }
}
