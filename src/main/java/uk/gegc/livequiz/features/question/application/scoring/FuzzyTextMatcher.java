package uk.gegc.livequiz.features.question.application.scoring;

import org.springframework.stereotype.Component;

/**
 * Levenshtein edit distance with unit costs for insertion, deletion and substitution.
 * Inputs are compared as-is; callers normalize first.
 */
@Component
public class FuzzyTextMatcher {

    public int distance(String a, String b) {
        int m = a.length();
        int n = b.length();
        int[][] dp = new int[m + 1][n + 1];

        for (int i = 0; i <= m; i++) {
            dp[i][0] = i;
        }
        for (int j = 0; j <= n; j++) {
            dp[0][j] = j;
        }

        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    dp[i][j] = dp[i - 1][j - 1];
                } else {
                    dp[i][j] = 1 + Math.min(dp[i - 1][j - 1], Math.min(dp[i - 1][j], dp[i][j - 1]));
                }
            }
        }
        return dp[m][n];
    }

    /**
     * {@code 1 - distance / max(len)}; 0 when either side is empty.
     */
    public double similarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        return 1.0 - ((double) distance(a, b) / maxLength);
    }
}
