package com.tickerbot.news.match;

import com.tickerbot.news.model.DetectionMethod;

/**
 * A candidate generator could not produce a result. Recovered by the fan-out as an
 * empty signal set.
 */
public class GeneratorFailure extends RuntimeException {
    private final DetectionMethod method;

    public GeneratorFailure(DetectionMethod method, String message) {
        super(message);
        this.method = method;
    }

    public GeneratorFailure(DetectionMethod method, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
    }

    public DetectionMethod method() {
        return method;
    }
}
