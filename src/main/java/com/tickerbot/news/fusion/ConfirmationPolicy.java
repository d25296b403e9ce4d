package com.tickerbot.news.fusion;

import com.tickerbot.news.model.FusedResult;

import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps fused results whose score reaches the threshold (inclusive). Everything below
 * is dropped, not stored as a low-confidence row.
 */
public final class ConfirmationPolicy {
    private final double threshold;

    public ConfirmationPolicy(double threshold) {
        this.threshold = threshold;
    }

    public boolean isConfirmed(FusedResult result) {
        return result != null && result.fusedScore >= threshold;
    }

    public Map<Long, FusedResult> confirm(Map<Long, FusedResult> fused) {
        Map<Long, FusedResult> out = new TreeMap<>();
        if (fused == null) {
            return out;
        }
        for (Map.Entry<Long, FusedResult> entry : fused.entrySet()) {
            if (isConfirmed(entry.getValue())) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }
}
