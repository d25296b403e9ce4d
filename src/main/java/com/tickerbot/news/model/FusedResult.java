package com.tickerbot.news.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Merged per-ticker confidence for one article, with the representative evidence
 * and each method's weighted contribution.
 */
public final class FusedResult {
    public final long tickerId;
    public final double fusedScore;
    public final String mentionText;
    public final MentionType mentionType;
    public final DetectionMethod method;
    public final Map<DetectionMethod, Double> contributions;

    public FusedResult(
            long tickerId,
            double fusedScore,
            String mentionText,
            MentionType mentionType,
            DetectionMethod method,
            Map<DetectionMethod, Double> contributions
    ) {
        this.tickerId = tickerId;
        this.fusedScore = fusedScore;
        this.mentionText = mentionText == null ? "" : mentionText;
        this.mentionType = mentionType;
        this.method = method;
        EnumMap<DetectionMethod, Double> copy = new EnumMap<>(DetectionMethod.class);
        if (contributions != null) {
            copy.putAll(contributions);
        }
        this.contributions = Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "FusedResult{" + tickerId + " score=" + fusedScore + " via " + method.wireName() + " '" + mentionText + "'}";
    }
}
