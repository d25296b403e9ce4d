package com.tickerbot.news.match;

import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;

import java.util.Map;

/**
 * One generator's result for one article. Failed and timed-out generators carry an
 * empty signal map.
 */
public record GeneratorOutcome(
        DetectionMethod method,
        Map<Long, CandidateSignal> signals,
        Status status,
        long elapsedMs,
        String error
) {
    public enum Status {
        OK,
        FAILED,
        TIMED_OUT
    }

    public static GeneratorOutcome ok(DetectionMethod method, Map<Long, CandidateSignal> signals, long elapsedMs) {
        return new GeneratorOutcome(method, signals == null ? Map.of() : Map.copyOf(signals), Status.OK, elapsedMs, "");
    }

    public static GeneratorOutcome degraded(DetectionMethod method, Status status, long elapsedMs, String error) {
        return new GeneratorOutcome(method, Map.of(), status, elapsedMs, error == null ? "" : error);
    }

    public boolean isDegraded() {
        return status != Status.OK;
    }
}
