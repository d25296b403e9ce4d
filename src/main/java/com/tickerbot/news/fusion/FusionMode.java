package com.tickerbot.news.fusion;

import java.util.Locale;

/**
 * How per-method contributions for one ticker are combined.
 */
public enum FusionMode {
    /** Highest weighted contribution wins. */
    MAX,
    /** Noisy-OR over weighted contributions: {@code 1 - prod(1 - w*s)}. */
    ADDITIVE;

    public static FusionMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return MAX;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if ("WEIGHTED_MAX".equals(value)) {
            return MAX;
        }
        if ("NOISY_OR".equals(value)) {
            return ADDITIVE;
        }
        return FusionMode.valueOf(value);
    }
}
