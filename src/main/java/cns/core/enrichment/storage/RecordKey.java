package cns.core.enrichment.storage;

import java.util.Locale;

public record RecordKey(String mpn, String manufacturer) {

    private static final String SEPARATOR = "|";

    public RecordKey {
        if (mpn == null || mpn.isBlank()) {
            throw new IllegalArgumentException("mpn is required");
        }
        mpn = mpn.trim().toUpperCase(Locale.ROOT);
        manufacturer = manufacturer == null ? "" : manufacturer.trim().toUpperCase(Locale.ROOT);
    }

    public static RecordKey of(String mpn, String manufacturer) {
        return new RecordKey(mpn, manufacturer);
    }

    public static RecordKey parse(String value) {
        int separator = value.indexOf(SEPARATOR);
        if (separator < 0) {
            return new RecordKey(value, "");
        }
        return new RecordKey(value.substring(0, separator), value.substring(separator + 1));
    }

    public String value() {
        return mpn + SEPARATOR + manufacturer;
    }

    @Override
    public String toString() {
        return value();
    }
}
