package com.example.cusplitter.domain.support;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Shared normalization for every personal name that takes part in matching.
 * Certificates and roster rows must go through the same rules, otherwise the exact and fuzzy
 * comparisons drift apart.
 */
public final class NameNormalizer {

    private NameNormalizer() {
    }

    /**
     * Uppercases the value, strips diacritics and punctuation and collapses whitespace.
     *
     * @param value raw name as read from a PDF or CSV cell
     * @return normalized name or {@code null} when nothing usable is left
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "");
        String cleaned = decomposed.toUpperCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .strip();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Normalizes a fiscal code: uppercase, no whitespace.
     *
     * @param value raw code
     * @return normalized code or {@code null} when blank
     */
    public static String normalizeFiscalCode(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Turns an uppercase name into title case, e.g. {@code DE LUCA} into {@code De Luca}.
     *
     * @param value normalized name
     * @return title-cased name or an empty string
     */
    public static String toTitleCase(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return Arrays.stream(value.strip().split("\\s+"))
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT)
                        + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
