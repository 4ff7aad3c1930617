package com.example.cusplitter.domain.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural rules of the Italian codice fiscale.
 * Digit positions also accept the omocodia substitutes {@code LMNPQRSTUV}; the last character is
 * a check letter computed from the first fifteen.
 */
public final class FiscalCodes {

    public static final int LENGTH = 16;

    private static final String DIGIT = "[0-9LMNPQRSTUV]";
    private static final String LAYOUT = "[A-Z]{6}" + DIGIT + "{2}[ABCDEHLMPRST]" + DIGIT + "{2}[A-Z]" + DIGIT + "{3}[A-Z]";
    private static final Pattern WELL_FORMED = Pattern.compile(LAYOUT);
    private static final Pattern CANDIDATE = Pattern.compile("(?<![A-Z0-9])(" + LAYOUT + ")(?![A-Z0-9])");

    private static final int[] ODD_VALUES = {
            1, 0, 5, 7, 9, 13, 15, 17, 19, 21, 2, 4, 18, 20, 11, 3, 6, 8, 12, 14, 16, 10, 22, 25, 24, 23
    };

    private FiscalCodes() {
    }

    /**
     * @param code normalized code
     * @return {@code true} when the code has the right length and character layout
     */
    public static boolean isWellFormed(String code) {
        return code != null && WELL_FORMED.matcher(code).matches();
    }

    /**
     * @param code normalized code
     * @return {@code true} when the layout is right and the check letter matches
     */
    public static boolean isValid(String code) {
        return isWellFormed(code) && checkCharacter(code.substring(0, LENGTH - 1)) == code.charAt(LENGTH - 1);
    }

    /**
     * Computes the check letter for the first fifteen characters of a code.
     *
     * @param body fifteen uppercase alphanumeric characters
     * @return expected sixteenth character
     */
    public static char checkCharacter(String body) {
        if (body == null || body.length() != LENGTH - 1) {
            throw new IllegalArgumentException("Fiscal code body must have " + (LENGTH - 1) + " characters");
        }
        int sum = 0;
        for (int i = 0; i < body.length(); i++) {
            int ordinal = ordinal(body.charAt(i));
            // positions are 1-based in the official algorithm, so index 0 is "odd"
            sum += i % 2 == 0 ? ODD_VALUES[ordinal] : ordinal;
        }
        return (char) ('A' + sum % 26);
    }

    /**
     * Lists every well-formed candidate in the text in order of appearance, valid or not.
     *
     * @param text text to scan, case is ignored
     * @return candidates as uppercase strings
     */
    public static List<String> findCandidates(String text) {
        List<String> candidates = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return candidates;
        }
        Matcher matcher = CANDIDATE.matcher(text.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            candidates.add(matcher.group(1));
        }
        return candidates;
    }

    private static int ordinal(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'Z') {
            return c - 'A';
        }
        throw new IllegalArgumentException("Unexpected fiscal code character: " + c);
    }
}
