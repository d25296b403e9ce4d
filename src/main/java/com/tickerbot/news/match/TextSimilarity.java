package com.tickerbot.news.match;

import com.tickerbot.news.model.TickerDictionary;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * String similarity helpers in [0, 1]. Inputs are compared in normalized form.
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    public static int levenshtein(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[b.length()];
    }

    /**
     * {@code 1 - distance / longerLength}.
     */
    public static double ratio(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int longer = Math.max(left.length(), right.length());
        if (longer == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / longer;
    }

    /**
     * Ratio after sorting the words of both sides, so word order does not matter.
     */
    public static double tokenSortRatio(String a, String b) {
        return ratio(sortedWords(a), sortedWords(b));
    }

    public static double similarity(String a, String b) {
        String left = TickerDictionary.normalize(a);
        String right = TickerDictionary.normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        return Math.max(ratio(left, right), tokenSortRatio(left, right));
    }

    /**
     * True when every word of the shorter side appears among the words of the longer one.
     */
    public static boolean wordContainment(String a, String b) {
        List<String> left = words(TickerDictionary.normalize(a));
        List<String> right = words(TickerDictionary.normalize(b));
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        List<String> shorter = left.size() <= right.size() ? left : right;
        Set<String> longer = new HashSet<>(left.size() <= right.size() ? right : left);
        return longer.containsAll(shorter);
    }

    private static String sortedWords(String value) {
        List<String> words = words(value == null ? "" : value);
        String[] sorted = words.toArray(new String[0]);
        Arrays.sort(sorted);
        return String.join(" ", sorted);
    }

    private static List<String> words(String normalized) {
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}
