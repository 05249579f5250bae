package cns.core.enrichment.quality;

import cns.core.enrichment.domain.FieldStatus;
import java.util.List;
import java.util.Map;

public record ComparisonResult(
        Map<String, Object> normalized,
        List<FieldDiff> diffs) {

    public List<FieldDiff> withStatus(FieldStatus status) {
        return diffs.stream()
                .filter(diff -> diff.status() == status)
                .toList();
    }

    public FieldDiff diff(ComponentField field) {
        return diffs.stream()
                .filter(diff -> diff.field().equals(field.key()))
                .findFirst()
                .orElse(null);
    }

    public boolean requiredFieldsPresent() {
        return ComponentField.inTier(FieldTier.REQUIRED).stream()
                .map(this::diff)
                .allMatch(diff -> diff != null && diff.present());
    }
}
