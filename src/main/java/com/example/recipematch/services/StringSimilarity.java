package com.example.recipematch.services;

/**
 * 0-100 likeness between two free-text terms: exact match, then containment,
 * then normalized Levenshtein distance.
 */
public class StringSimilarity {
    public static final int DEFAULT_CONTAINMENT_SCORE = 85;

    private final int containmentScore;

    public StringSimilarity() { this(DEFAULT_CONTAINMENT_SCORE); }
    public StringSimilarity(int containmentScore) { this.containmentScore = containmentScore; }

    public int score(String a, String b) {
        String s1 = a == null ? "" : a.trim().toLowerCase();
        String s2 = b == null ? "" : b.trim().toLowerCase();
        if (s1.equals(s2)) return 100;
        if (s1.contains(s2) || s2.contains(s1)) return containmentScore;

        int maxLen = Math.max(s1.length(), s2.length());
        int d = levenshtein(s1, s2);
        return (int) Math.max(0, Math.round((maxLen - d) * 100.0 / maxLen));
    }

    static int levenshtein(String s1, String s2) {
        int[] prev = new int[s2.length() + 1];
        int[] cur = new int[s2.length() + 1];
        for (int j = 0; j <= s2.length(); j++) prev[j] = j;
        for (int i = 1; i <= s1.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(prev[j] + 1, cur[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] t = prev; prev = cur; cur = t;
        }
        return prev[s2.length()];
    }
}
