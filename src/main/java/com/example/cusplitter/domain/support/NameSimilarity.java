package com.example.cusplitter.domain.support;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Edit-distance based similarity between two full names.
 * Tokens are sorted before comparison so "ROSSI MARIO" and "MARIO ROSSI" score 1.0.
 */
public final class NameSimilarity {

    private NameSimilarity() {
    }

    /**
     * @param left  normalized full name
     * @param right normalized full name
     * @return similarity in {@code [0, 1]}; 0 when either side is blank
     */
    public static double score(String left, String right) {
        if (left == null || right == null || left.isBlank() || right.isBlank()) {
            return 0d;
        }
        String sortedLeft = sortTokens(left);
        String sortedRight = sortTokens(right);
        int longest = Math.max(sortedLeft.length(), sortedRight.length());
        if (longest == 0) {
            return 0d;
        }
        return 1d - ((double) levenshteinDistance(sortedLeft, sortedRight) / longest);
    }

    static String sortTokens(String value) {
        return Arrays.stream(value.strip().split("\\s+"))
                .sorted()
                .collect(Collectors.joining(" "));
    }

    static int levenshteinDistance(String left, String right) {
        int leftLength = left.length();
        int rightLength = right.length();
        if (leftLength == 0) {
            return rightLength;
        }
        if (rightLength == 0) {
            return leftLength;
        }

        int[] previous = new int[rightLength + 1];
        int[] current = new int[rightLength + 1];
        for (int j = 0; j <= rightLength; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= leftLength; i++) {
            current[0] = i;
            for (int j = 1; j <= rightLength; j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[rightLength];
    }
}
