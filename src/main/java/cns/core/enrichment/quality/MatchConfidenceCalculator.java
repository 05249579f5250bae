package cns.core.enrichment.quality;

import cns.core.enrichment.config.EnrichmentProperties;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class MatchConfidenceCalculator {

    private static final double MPN_WEIGHT = 0.7;
    private static final double MANUFACTURER_WEIGHT = 0.3;
    private static final double UNVERIFIED = 0.8;
    private static final Set<String> COMPANY_SUFFIXES = Set.of(
            "INC", "INCORPORATED", "CORP", "CORPORATION", "CO", "COMPANY",
            "LTD", "LIMITED", "LLC", "GMBH", "AG", "SA", "PLC", "BV", "NV");

    private final Map<String, String> aliases = new HashMap<>();

    public MatchConfidenceCalculator(EnrichmentProperties properties) {
        properties.getManufacturerAliases().forEach((alias, canonical) ->
                aliases.put(stripSuffixes(alias), stripSuffixes(canonical)));
    }

    public double matchConfidence(String requestedMpn, String requestedManufacturer,
                                  String returnedMpn, String returnedManufacturer) {
        double mpn = mpnSimilarity(requestedMpn, returnedMpn);
        double manufacturer = manufacturerSimilarity(requestedManufacturer, returnedManufacturer);
        return MPN_WEIGHT * mpn + MANUFACTURER_WEIGHT * manufacturer;
    }

    public String canonicalManufacturer(String manufacturer) {
        if (manufacturer == null || manufacturer.isBlank()) {
            return "";
        }
        String stripped = stripSuffixes(manufacturer);
        return aliases.getOrDefault(stripped, stripped);
    }

    double mpnSimilarity(String requested, String returned) {
        String left = normalizeMpn(requested);
        String right = normalizeMpn(returned);
        if (right.isEmpty()) {
            return UNVERIFIED;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.isEmpty()) {
            return 0.0;
        }
        // orderable variants such as LM358DR for LM358
        if (right.startsWith(left) || left.startsWith(right)) {
            return 0.9;
        }
        int maxLength = Math.max(left.length(), right.length());
        double similarity = 1.0 - (double) levenshtein(left, right) / maxLength;
        return Math.max(0.0, similarity) * 0.8;
    }

    double manufacturerSimilarity(String requested, String returned) {
        String left = canonicalManufacturer(requested);
        if (left.isEmpty()) {
            return 1.0;
        }
        String right = canonicalManufacturer(returned);
        if (right.isEmpty()) {
            return UNVERIFIED;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.contains(right) || right.contains(left)) {
            return 0.9;
        }
        int maxLength = Math.max(left.length(), right.length());
        return Math.max(0.0, 1.0 - (double) levenshtein(left, right) / maxLength) * 0.6;
    }

    static String normalizeMpn(String mpn) {
        if (mpn == null) {
            return "";
        }
        return mpn.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
    }

    private static String stripSuffixes(String name) {
        String cleaned = name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", " ").trim();
        return Arrays.stream(cleaned.split(" "))
                .filter(token -> !token.isEmpty() && !COMPANY_SUFFIXES.contains(token))
                .collect(Collectors.joining(" "));
    }

    private static int levenshtein(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }
}
