package com.polpas.orderbot.conversation.util;

import org.springframework.stereotype.Component;

/**
 * Levenshtein-based similarity between folded strings, as a percentage of the longer string.
 */
@Component
public class FuzzyMatcher {

    private final TextNormalizer normalizer;

    public FuzzyMatcher(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public double similarity(String a, String b) {
        String left = normalizer.fold(a);
        String right = normalizer.fold(b);
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 100.0;
        }
        int distance = levenshteinDistance(left, right);
        return (1.0 - (double) distance / maxLength) * 100.0;
    }

    static int levenshteinDistance(String a, String b) {
        int m = a.length();
        int n = b.length();
        if (m == 0) {
            return n;
        }
        if (n == 0) {
            return m;
        }
        int[][] dp = new int[m + 1][n + 1];
        for (int i = 0; i <= m; i++) {
            dp[i][0] = i;
        }
        for (int j = 0; j <= n; j++) {
            dp[0][j] = j;
        }
        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                dp[i][j] = Math.min(
                        Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1),
                        dp[i - 1][j - 1] + cost);
            }
        }
        return dp[m][n];
    }
}
