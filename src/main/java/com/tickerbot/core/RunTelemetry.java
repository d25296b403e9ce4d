package com.tickerbot.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-run step timings and article counters, rendered as a plain-text block for the log.
 */
public final class RunTelemetry {
    public static final String STEP_LOAD_TICKERS = "LOAD_TICKERS";
    public static final String STEP_DEDUP = "DEDUP";
    public static final String STEP_MATCH = "MATCH";
    public static final String STEP_PERSIST = "PERSIST";
    public static final String STEP_RECORD_RUN = "RECORD_RUN";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String jobType;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private int articlesIn;
    private int newArticles;
    private int duplicates;
    private int failedArticles;
    private int mentions;
    private int degradedGenerators;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String jobType, String trigger, Instant startedAt) {
        this.jobType = blankTo(jobType, "pipeline");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String jobType() {
        return jobType;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public synchronized void countArticle() {
        articlesIn++;
    }

    public synchronized void countNew() {
        newArticles++;
    }

    public synchronized void countDuplicate() {
        duplicates++;
    }

    public synchronized void countFailed() {
        failedArticles++;
    }

    public synchronized void countMentions(int count) {
        mentions += Math.max(0, count);
    }

    public synchronized void countDegradedGenerators(int count) {
        degradedGenerators += Math.max(0, count);
    }

    public synchronized int newArticles() {
        return newArticles;
    }

    public synchronized int duplicates() {
        return duplicates;
    }

    public synchronized int failedArticles() {
        return failedArticles;
    }

    public synchronized int mentions() {
        return mentions;
    }

    public synchronized int degradedGenerators() {
        return degradedGenerators;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount));
        }
        return out;
    }

    /**
     * One-line counters, stored with the run record.
     */
    public synchronized String countersLine() {
        return String.format(
                Locale.US,
                "articles=%d new=%d duplicates=%d failed=%d mentions=%d degraded_generators=%d",
                articlesIn,
                newArticles,
                duplicates,
                failedArticles,
                mentions,
                degradedGenerators
        );
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("job_type=").append(jobType).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append(countersLine()).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount
    ) {
    }
}
