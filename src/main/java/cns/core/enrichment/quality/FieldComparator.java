package cns.core.enrichment.quality;

import cns.core.enrichment.domain.DataQuality;
import cns.core.enrichment.domain.FieldStatus;
import cns.core.enrichment.exception.FieldValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class FieldComparator {

    static final double CORROBORATION_BONUS = 0.05;

    private final FieldNormalizer normalizer;

    public FieldComparator(FieldNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public ComparisonResult compare(Map<String, Object> supplierFields,
                                    Map<String, Double> fieldConfidence,
                                    double defaultConfidence,
                                    Map<String, Object> storedFields) {
        Map<String, Object> supplied = supplierFields == null ? Collections.emptyMap() : supplierFields;
        Map<String, Double> confidences = fieldConfidence == null ? Collections.emptyMap() : fieldConfidence;
        Map<String, Object> stored = storedFields == null ? Collections.emptyMap() : storedFields;

        Map<String, Object> normalized = new LinkedHashMap<>();
        List<FieldDiff> diffs = new ArrayList<>();
        for (ComponentField field : ComponentField.values()) {
            Object raw = supplied.get(field.key());
            String storedValue = normalizer.canonical(storedValue(field, stored.get(field.key())));
            double supplierConfidence = clamp(confidences.getOrDefault(field.key(), defaultConfidence));
            diffs.add(compareField(field, raw, storedValue, supplierConfidence, normalized));
        }
        return new ComparisonResult(normalized, List.copyOf(diffs));
    }

    private FieldDiff compareField(ComponentField field,
                                   Object raw,
                                   String storedValue,
                                   double supplierConfidence,
                                   Map<String, Object> normalized) {
        String supplierValue = raw == null ? null : raw.toString();
        Object value;
        try {
            value = normalizer.normalize(field, raw);
        } catch (FieldValidationException ex) {
            return new FieldDiff(field.key(), supplierValue, storedValue, null, FieldStatus.INVALID,
                    ex.getMessage(), 0.0, DataQuality.fromConfidence(supplierConfidence));
        }
        if (value == null) {
            String reason = storedValue == null ? "not_provided" : "supplier_omitted_stored_value";
            return new FieldDiff(field.key(), supplierValue, storedValue, null, FieldStatus.MISSING,
                    reason, 0.0, DataQuality.NONE);
        }

        normalized.put(field.key(), value);
        String canonical = normalizer.canonical(value);
        DataQuality quality = DataQuality.fromConfidence(supplierConfidence);
        if (storedValue == null) {
            return new FieldDiff(field.key(), supplierValue, null, canonical, FieldStatus.CHANGED,
                    "no_stored_value", supplierConfidence, quality);
        }
        if (Objects.equals(storedValue, canonical)) {
            return new FieldDiff(field.key(), supplierValue, storedValue, canonical, FieldStatus.UNCHANGED,
                    null, clamp(supplierConfidence + CORROBORATION_BONUS), quality);
        }
        return new FieldDiff(field.key(), supplierValue, storedValue, canonical, FieldStatus.CHANGED,
                "supplier_value_differs", supplierConfidence, quality);
    }

    private Object storedValue(ComponentField field, Object stored) {
        try {
            return normalizer.normalize(field, stored);
        } catch (FieldValidationException ex) {
            return stored;
        }
    }

    private static double clamp(Double value) {
        if (value == null || value.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
