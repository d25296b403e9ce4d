package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.TickerDictionary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the enabled generators for one article on a bounded worker pool.
 * <p>
 * Every generator gets the same deadline, counted from the moment its task starts
 * running, so time spent queued behind other articles does not count against it. A
 * generator that throws or misses the deadline is cancelled and contributes an empty
 * result; the others are unaffected. The pool is shared by all articles of a run, so
 * the concurrency limit bounds in-flight generator calls across the whole run.
 */
public final class GeneratorFanout implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(GeneratorFanout.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();
    private static final long NOT_STARTED = Long.MIN_VALUE;
    private static final long QUEUED_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(20L);

    private final List<CandidateGenerator> generators;
    private final PipelineSettings settings;
    private final ExecutorService pool;

    public GeneratorFanout(List<CandidateGenerator> generators, PipelineSettings settings) {
        this.generators = List.copyOf(generators);
        this.settings = settings;
        this.pool = Executors.newFixedThreadPool(settings.getGeneratorConcurrency(), namedDaemonThreads());
    }

    /**
     * @throws CancellationException when the calling thread is interrupted while waiting
     */
    public List<GeneratorOutcome> run(String articleRef, ArticleText text, TickerDictionary dictionary) {
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(settings.getGeneratorTimeoutMs());

        Map<DetectionMethod, Future<Map<Long, CandidateSignal>>> futures = new LinkedHashMap<>();
        Map<DetectionMethod, AtomicLong> startedAt = new LinkedHashMap<>();
        for (CandidateGenerator generator : generators) {
            AtomicLong started = new AtomicLong(NOT_STARTED);
            startedAt.put(generator.method(), started);
            futures.put(generator.method(), pool.submit(() -> {
                started.set(System.nanoTime());
                return generator.generate(text, dictionary, settings);
            }));
        }

        List<GeneratorOutcome> outcomes = new ArrayList<>(futures.size());
        try {
            for (Map.Entry<DetectionMethod, Future<Map<Long, CandidateSignal>>> entry : futures.entrySet()) {
                DetectionMethod method = entry.getKey();
                Future<Map<Long, CandidateSignal>> future = entry.getValue();
                AtomicLong started = startedAt.get(method);
                try {
                    Map<Long, CandidateSignal> signals = await(future, started, timeoutNanos);
                    outcomes.add(GeneratorOutcome.ok(method, sanitize(method, signals), elapsedMs(started)));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("generator timed out, degrading to empty result: method={} article={} timeout_ms={}",
                            method.wireName(), articleRef, settings.getGeneratorTimeoutMs());
                    outcomes.add(GeneratorOutcome.degraded(method, GeneratorOutcome.Status.TIMED_OUT,
                            elapsedMs(started), "timeout after " + settings.getGeneratorTimeoutMs() + "ms"));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("generator failed, degrading to empty result: method={} article={} err={}",
                            method.wireName(), articleRef, cause.toString());
                    outcomes.add(GeneratorOutcome.degraded(method, GeneratorOutcome.Status.FAILED,
                            elapsedMs(started), String.valueOf(cause.getMessage())));
                }
            }
        } catch (InterruptedException e) {
            for (Future<?> future : futures.values()) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new CancellationException("generator fan-out interrupted for article " + articleRef);
        }
        return outcomes;
    }

    // Waits while the task is queued; the deadline only runs once the task has started.
    private static Map<Long, CandidateSignal> await(
            Future<Map<Long, CandidateSignal>> future,
            AtomicLong startedAt,
            long timeoutNanos
    ) throws InterruptedException, ExecutionException, TimeoutException {
        while (true) {
            long started = startedAt.get();
            long wait = started == NOT_STARTED
                    ? QUEUED_POLL_NANOS
                    : Math.max(0L, started + timeoutNanos - System.nanoTime());
            try {
                return future.get(wait, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (started != NOT_STARTED) {
                    throw e;
                }
            }
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    // Drops signals that disagree with their map key or claim another method.
    private Map<Long, CandidateSignal> sanitize(DetectionMethod method, Map<Long, CandidateSignal> signals) {
        if (signals == null || signals.isEmpty()) {
            return Map.of();
        }
        Map<Long, CandidateSignal> out = new LinkedHashMap<>();
        for (Map.Entry<Long, CandidateSignal> entry : signals.entrySet()) {
            CandidateSignal signal = entry.getValue();
            if (signal == null || entry.getKey() == null || signal.tickerId != entry.getKey() || signal.method != method) {
                log.debug("dropping inconsistent signal from {}: {}", method.wireName(), signal);
                continue;
            }
            out.put(entry.getKey(), signal);
        }
        return out;
    }

    private static long elapsedMs(AtomicLong startedAt) {
        long started = startedAt.get();
        return started == NOT_STARTED ? 0L : Math.max(0L, (System.nanoTime() - started) / 1_000_000L);
    }

    private static ThreadFactory namedDaemonThreads() {
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "generator-" + poolId + "-" + threadSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
