package cns.core.enrichment.quality;

import cns.core.enrichment.exception.FieldValidationException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class FieldNormalizer {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "y", "1", "compliant");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "n", "0", "non-compliant", "not compliant");

    public Object normalize(ComponentField field, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String text && text.isBlank()) {
            return null;
        }
        return switch (field.kind()) {
            case TEXT -> text(field, raw);
            case URL -> url(field, raw);
            case DECIMAL -> decimal(field, raw);
            case INTEGER -> integer(field, raw);
            case BOOLEAN -> bool(field, raw);
            case LIST -> list(field, raw);
            case MAP -> map(field, raw);
        };
    }

    /**
     * Stable string form used to compare a normalized value with a stored one.
     */
    public String canonical(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Map<?, ?> map) {
            return new TreeMap<>(map).toString();
        }
        return value.toString();
    }

    private String text(ComponentField field, Object raw) {
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
            throw invalid(field, "expected text but got a structured value");
        }
        String value = raw.toString().trim().replaceAll("\\s+", " ");
        return value.isEmpty() ? null : value;
    }

    private String url(ComponentField field, Object raw) {
        String value = raw.toString().trim();
        if (value.startsWith("//")) {
            value = "https:" + value;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw invalid(field, "not an http(s) URL: " + value);
            }
            return uri.toString();
        } catch (URISyntaxException ex) {
            throw invalid(field, "malformed URL: " + value);
        }
    }

    private BigDecimal decimal(ComponentField field, Object raw) {
        BigDecimal value;
        if (raw instanceof BigDecimal decimal) {
            value = decimal;
        } else if (raw instanceof Number number) {
            value = new BigDecimal(number.toString());
        } else {
            String cleaned = raw.toString().trim().replaceAll("[$€£¥,\\s]", "");
            try {
                value = new BigDecimal(cleaned);
            } catch (NumberFormatException ex) {
                throw invalid(field, "not a number: " + raw);
            }
        }
        if (value.signum() < 0) {
            throw invalid(field, "negative value: " + value);
        }
        return value;
    }

    private Long integer(ComponentField field, Object raw) {
        BigDecimal value;
        if (raw instanceof Number number) {
            value = new BigDecimal(number.toString());
        } else {
            String cleaned = raw.toString().trim().replaceAll("[,\\s+]", "");
            try {
                value = new BigDecimal(cleaned);
            } catch (NumberFormatException ex) {
                throw invalid(field, "not an integer: " + raw);
            }
        }
        if (value.signum() < 0) {
            throw invalid(field, "negative value: " + value);
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException ex) {
            throw invalid(field, "not a whole number: " + raw);
        }
    }

    private Boolean bool(ComponentField field, Object raw) {
        if (raw instanceof Boolean flag) {
            return flag;
        }
        String token = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(token)) {
            return Boolean.FALSE;
        }
        throw invalid(field, "not a boolean: " + raw);
    }

    private List<?> list(ComponentField field, Object raw) {
        if (!(raw instanceof Collection<?> values)) {
            throw invalid(field, "expected a list");
        }
        if (values.isEmpty()) {
            return null;
        }
        return List.copyOf(values);
    }

    private Map<String, Object> map(ComponentField field, Object raw) {
        if (!(raw instanceof Map<?, ?> values)) {
            throw invalid(field, "expected an object");
        }
        if (values.isEmpty()) {
            return null;
        }
        Map<String, Object> sorted = new TreeMap<>();
        values.forEach((key, value) -> sorted.put(String.valueOf(key), value));
        return sorted;
    }

    private FieldValidationException invalid(ComponentField field, String message) {
        return new FieldValidationException(field.key(), field.key() + ": " + message);
    }
}
