package com.tickerbot.news.model;

/**
 * One generator's unmerged claim that an article mentions a ticker. Never persisted.
 */
public final class CandidateSignal {
    public final long tickerId;
    public final String mentionText;
    public final MentionType mentionType;
    public final DetectionMethod method;
    public final double rawScore;

    public CandidateSignal(long tickerId, String mentionText, MentionType mentionType, DetectionMethod method, double rawScore) {
        if (mentionType == null || method == null) {
            throw new IllegalArgumentException("mentionType and method are required");
        }
        if (Double.isNaN(rawScore) || rawScore < 0.0 || rawScore > 1.0) {
            throw new IllegalArgumentException("rawScore out of [0,1]: " + rawScore);
        }
        this.tickerId = tickerId;
        this.mentionText = mentionText == null ? "" : mentionText;
        this.mentionType = mentionType;
        this.method = method;
        this.rawScore = rawScore;
    }

    /**
     * Keeps the stronger of two signals from the same generator for one ticker.
     */
    public static CandidateSignal stronger(CandidateSignal current, CandidateSignal candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null) {
            return current;
        }
        if (candidate.rawScore > current.rawScore) {
            return candidate;
        }
        if (candidate.rawScore == current.rawScore && candidate.mentionType.ordinal() < current.mentionType.ordinal()) {
            return candidate;
        }
        return current;
    }

    @Override
    public String toString() {
        return method.wireName() + "[" + tickerId + " '" + mentionText + "' " + mentionType.wireName() + " " + rawScore + "]";
    }
}
