package com.sashkomusic.catalogingest.domain.service.utils;

import java.util.Locale;

public final class StringSimilarity {

    private StringSimilarity() {
    }

    /**
     * Lower-cases, drops everything that is not a letter, digit or whitespace, and collapses whitespace.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Ratcliff/Obershelp ratio: {@code 2 * matches / (|a| + |b|)}, where matches is the total length of
     * the longest common block and, recursively, the blocks left and right of it.
     */
    public static double ratio(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        int matches = matchingCharacters(a, 0, a.length(), b, 0, b.length());
        return 2.0 * matches / (a.length() + b.length());
    }

    private static int matchingCharacters(String a, int aStart, int aEnd, String b, int bStart, int bEnd) {
        if (aStart >= aEnd || bStart >= bEnd) {
            return 0;
        }
        int bestLength = 0;
        int bestA = aStart;
        int bestB = bStart;
        int[] previous = new int[bEnd - bStart + 1];
        for (int i = aStart; i < aEnd; i++) {
            int[] current = new int[bEnd - bStart + 1];
            for (int j = bStart; j < bEnd; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int length = previous[j - bStart] + 1;
                    current[j - bStart + 1] = length;
                    if (length > bestLength) {
                        bestLength = length;
                        bestA = i - length + 1;
                        bestB = j - length + 1;
                    }
                }
            }
            previous = current;
        }
        if (bestLength == 0) {
            return 0;
        }
        return bestLength
                + matchingCharacters(a, aStart, bestA, b, bStart, bestB)
                + matchingCharacters(a, bestA + bestLength, aEnd, b, bestB + bestLength, bEnd);
    }
}
