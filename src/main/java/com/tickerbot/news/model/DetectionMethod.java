package com.tickerbot.news.model;

import java.util.Locale;

/**
 * Candidate generator kinds. {@link #precedence()} orders methods when two signals
 * carry the same weighted contribution: lower wins.
 */
public enum DetectionMethod {
    SUBSTRING(0),
    NER(1),
    FUZZY(2),
    SEMANTIC(3);

    private final int precedence;

    DetectionMethod(int precedence) {
        this.precedence = precedence;
    }

    public int precedence() {
        return precedence;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DetectionMethod fromWireName(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("detection method is null");
        }
        return DetectionMethod.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
