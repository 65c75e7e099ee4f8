package com.faqchat.util;

import java.util.Set;

/**
 * Lexical similarity measures, each normalized to [0, 1].
 */
public final class SimilarityMetrics {

    private SimilarityMetrics() {
    }

    /**
     * Shared tokens divided by the union of tokens. Two empty sets score 0.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        int union = a.size() + b.size() - shared;
        return (double) shared / union;
    }

    /**
     * {@code 1 - levenshtein(a, b) / max(|a|, |b|)}, measured in code points.
     */
    public static double levenshteinRatio(String a, String b) {
        int[] s = a.codePoints().toArray();
        int[] t = b.codePoints().toArray();
        int longest = Math.max(s.length, t.length);
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(s, t) / longest;
    }

    static int levenshtein(int[] s, int[] t) {
        int[] prev = new int[t.length + 1];
        int[] curr = new int[t.length + 1];
        for (int j = 0; j <= t.length; j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= s.length; i++) {
            curr[0] = i;
            for (int j = 1; j <= t.length; j++) {
                int cost = s[i - 1] == t[j - 1] ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[t.length];
    }
}
