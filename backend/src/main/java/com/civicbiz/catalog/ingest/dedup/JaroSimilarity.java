package com.civicbiz.catalog.ingest.dedup;

/**
 * Jaro similarity between two strings, in [0, 1]. Characters match when equal and no further
 * apart than {@code max(len1, len2) / 2 - 1} positions.
 */
public final class JaroSimilarity {

    private JaroSimilarity() {
    }

    public static double similarity(String first, String second) {
        String s1 = first == null ? "" : first;
        String s2 = second == null ? "" : second;
        if (s1.isEmpty() && s2.isEmpty()) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        int len1 = s1.length();
        int len2 = s2.length();
        int window = Math.max(0, Math.max(len1, len2) / 2 - 1);
        boolean[] matched1 = new boolean[len1];
        boolean[] matched2 = new boolean[len2];

        int matches = 0;
        for (int i = 0; i < len1; i++) {
            int start = Math.max(0, i - window);
            int end = Math.min(len2 - 1, i + window);
            for (int j = start; j <= end; j++) {
                if (matched2[j] || s1.charAt(i) != s2.charAt(j)) {
                    continue;
                }
                matched1[i] = true;
                matched2[j] = true;
                matches++;
                break;
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int outOfOrder = 0;
        int k = 0;
        for (int i = 0; i < len1; i++) {
            if (!matched1[i]) {
                continue;
            }
            while (!matched2[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                outOfOrder++;
            }
            k++;
        }
        double transpositions = outOfOrder / 2.0;
        double m = matches;
        return (m / len1 + m / len2 + (m - transpositions) / m) / 3.0;
    }
}
