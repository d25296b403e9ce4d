package com.tickerbot.news.runner;

import com.tickerbot.core.RunTelemetry;
import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.db.NewsRepository;
import com.tickerbot.news.db.PersistenceFailure;
import com.tickerbot.news.db.RepositorySession;
import com.tickerbot.news.fusion.ConfirmationPolicy;
import com.tickerbot.news.fusion.SignalFuser;
import com.tickerbot.news.hash.ArticleHasher;
import com.tickerbot.news.match.CandidateGenerator;
import com.tickerbot.news.match.GeneratorFanout;
import com.tickerbot.news.model.FusedResult;
import com.tickerbot.news.model.InsertResult;
import com.tickerbot.news.model.ProcessingRun;
import com.tickerbot.news.model.RawArticle;
import com.tickerbot.news.model.RunStatus;
import com.tickerbot.news.model.StoredArticle;
import com.tickerbot.news.model.TickerDictionary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one processing run over a batch of fetched articles.
 * <p>
 * The calling thread owns the repository session: it hashes and stores each article,
 * persists mentions and appends the run record. Only the matching stages of new
 * articles run on the article pool. Dedup therefore goes through the store's hash
 * constraint one article at a time, and mentions are written by a single thread.
 * <p>
 * Exactly one {@link ProcessingRun} is recorded per call: {@code success},
 * {@code partial} when an article failed or the run was cancelled, {@code failed}
 * when the repository broke or the run hit an unexpected error. Rows committed before a failure or cancellation stay.
 */
public final class PipelineOrchestrator {
    private static final Logger log = LogManager.getLogger(PipelineOrchestrator.class);
    static final String JOB_TYPE = "pipeline";
    static final String UNKNOWN_SOURCE = "unknown";
    private static final long POLL_MS = 50L;
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final NewsRepository repository;
    private final List<CandidateGenerator> generators;
    private final PipelineSettings settings;
    private final SignalFuser fuser;
    private final ConfirmationPolicy policy;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public PipelineOrchestrator(NewsRepository repository, List<CandidateGenerator> generators, PipelineSettings settings) {
        this.settings = settings.validate();
        this.repository = repository;
        this.generators = List.copyOf(generators);
        this.fuser = SignalFuser.fromSettings(settings);
        this.policy = new ConfirmationPolicy(settings.getConfirmThreshold());
    }

    /**
     * Asks the in-flight run to stop. Articles not yet stored are skipped, pending
     * matches are abandoned and the run is recorded as {@code partial}. A request made
     * before a run starts applies to that run; the flag is cleared once a run ends.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public ProcessingRun run(List<RawArticle> batch) {
        return run(batch, null);
    }

    /**
     * @param dictionary ticker snapshot for this run; loaded from the repository when null
     */
    public ProcessingRun run(List<RawArticle> batch, TickerDictionary dictionary) {
        OffsetDateTime startedAt = OffsetDateTime.now(ZoneOffset.UTC);
        RunTelemetry telemetry = new RunTelemetry(JOB_TYPE, "manual", startedAt.toInstant());
        List<RawArticle> articles = batch == null ? List.of() : batch;
        log.info("pipeline run started: articles={} generators={}", articles.size(), methodNames());

        ProcessingRun result;
        Outcome outcome = Outcome.COMPLETED;
        RepositorySession session = null;
        try {
            session = repository.openSession();
            TickerDictionary snapshot = dictionary != null ? dictionary : loadDictionary(session, telemetry);
            outcome = process(session, articles, snapshot, telemetry);
            RunStatus status = outcome != Outcome.COMPLETED || telemetry.failedArticles() > 0
                    ? RunStatus.PARTIAL
                    : RunStatus.SUCCESS;
            ProcessingRun record = buildRun(startedAt, telemetry, status, outcome == Outcome.COMPLETED ? "" : "cancelled");
            telemetry.startStep(RunTelemetry.STEP_RECORD_RUN);
            long runId = session.recordRun(record);
            telemetry.endStep(RunTelemetry.STEP_RECORD_RUN, 1, 1, 0);
            result = record.toBuilder().id(runId).build();
        } catch (PersistenceFailure e) {
            log.error("pipeline run failed, repository unavailable: {}", e.getMessage(), e);
            result = recordFailedRun(buildRun(startedAt, telemetry, RunStatus.FAILED, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("pipeline run failed unexpectedly: {}", e.toString(), e);
            result = recordFailedRun(buildRun(startedAt, telemetry, RunStatus.FAILED, e.toString()));
        } finally {
            closeSession(session);
            cancelRequested.set(false);
        }

        telemetry.finish();
        log.info("pipeline run finished: status={}\n{}", result.getStatus().wireName(), telemetry.getSummary());
        if (outcome == Outcome.INTERRUPTED) {
            Thread.currentThread().interrupt();
        }
        return result;
    }

    private enum Outcome {
        COMPLETED,
        CANCELLED,
        INTERRUPTED
    }

    private Outcome process(
            RepositorySession session,
            List<RawArticle> articles,
            TickerDictionary dictionary,
            RunTelemetry telemetry
    ) throws PersistenceFailure {
        Map<String, Long> sourceIds = new HashMap<>();
        int poolSize = Math.max(1, Math.min(settings.getArticleConcurrency(), Math.max(1, articles.size())));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, articleThreads());
        CompletionService<ArticleMatchResult> completion = new ExecutorCompletionService<>(pool);
        List<Future<ArticleMatchResult>> submitted = new ArrayList<>();
        Outcome outcome = Outcome.COMPLETED;
        int pending = 0;

        try (GeneratorFanout fanout = new GeneratorFanout(generators, settings)) {
            ArticleMatcher matcher = new ArticleMatcher(fanout, fuser, policy);
            telemetry.startStep(RunTelemetry.STEP_MATCH);
            for (RawArticle raw : articles) {
                if (cancelRequested.get()) {
                    outcome = Outcome.CANCELLED;
                    break;
                }
                telemetry.countArticle();
                InsertResult inserted = dedupAndStore(session, raw, sourceIds, telemetry);
                if (!inserted.wasNew()) {
                    telemetry.countDuplicate();
                    continue;
                }
                telemetry.countNew();
                long articleId = inserted.articleId();
                submitted.add(completion.submit(() -> matcher.match(articleId, raw, dictionary)));
                pending++;

                Future<ArticleMatchResult> ready;
                while ((ready = completion.poll()) != null) {
                    pending--;
                    persist(session, ready, telemetry);
                }
            }
            while (pending > 0 && outcome == Outcome.COMPLETED) {
                if (cancelRequested.get()) {
                    outcome = Outcome.CANCELLED;
                    break;
                }
                Future<ArticleMatchResult> ready = completion.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (ready != null) {
                    pending--;
                    persist(session, ready, telemetry);
                }
            }
            telemetry.endStep(RunTelemetry.STEP_MATCH, telemetry.newArticles(), telemetry.mentions(), telemetry.failedArticles());
        } catch (InterruptedException e) {
            outcome = Outcome.INTERRUPTED;
        } finally {
            if (outcome != Outcome.COMPLETED) {
                for (Future<ArticleMatchResult> future : submitted) {
                    future.cancel(true);
                }
                log.warn("pipeline run cancelled: {} matched article(s) abandoned without mentions", pending);
            }
            pool.shutdownNow();
        }
        return outcome;
    }

    private TickerDictionary loadDictionary(RepositorySession session, RunTelemetry telemetry) throws PersistenceFailure {
        telemetry.startStep(RunTelemetry.STEP_LOAD_TICKERS);
        TickerDictionary dictionary = TickerDictionary.of(session.loadTickers());
        telemetry.endStep(RunTelemetry.STEP_LOAD_TICKERS, 0, dictionary.size(), 0);
        if (dictionary.isEmpty()) {
            log.warn("ticker dictionary is empty; no mentions can be confirmed");
        }
        return dictionary;
    }

    // FETCHED -> HASHED -> DUPLICATE | NEW
    private InsertResult dedupAndStore(
            RepositorySession session,
            RawArticle raw,
            Map<String, Long> sourceIds,
            RunTelemetry telemetry
    ) throws PersistenceFailure {
        telemetry.startStep(RunTelemetry.STEP_DEDUP);
        String hash = ArticleHasher.fingerprint(raw.title, raw.url);
        long sourceId = resolveSource(session, raw, sourceIds);
        InsertResult result = session.insertArticleIfNew(
                new StoredArticle(hash, raw.title, raw.url, raw.body, raw.publishedAt, sourceId));
        telemetry.endStep(RunTelemetry.STEP_DEDUP, 1, result.wasNew() ? 1 : 0, 0);
        if (!result.wasNew()) {
            log.debug("duplicate article skipped: id={} url={}", result.articleId(), raw.url);
        }
        return result;
    }

    private long resolveSource(RepositorySession session, RawArticle raw, Map<String, Long> cache) throws PersistenceFailure {
        if (raw.sourceId != null) {
            return raw.sourceId;
        }
        String name = raw.sourceName.isEmpty() ? UNKNOWN_SOURCE : raw.sourceName;
        Long cached = cache.get(name);
        if (cached != null) {
            return cached;
        }
        long id = session.ensureSource(name);
        cache.put(name, id);
        return id;
    }

    // CONFIRMING -> PERSISTED, or FAILED
    private void persist(
            RepositorySession session,
            Future<ArticleMatchResult> future,
            RunTelemetry telemetry
    ) throws PersistenceFailure, InterruptedException {
        ArticleMatchResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("article matching task failed: {}", cause.toString(), cause);
            telemetry.countFailed();
            return;
        }
        telemetry.countDegradedGenerators(result.degradedGenerators);
        if (result.isFailed()) {
            telemetry.countFailed();
            return;
        }

        telemetry.startStep(RunTelemetry.STEP_PERSIST);
        int written = 0;
        for (FusedResult mention : result.confirmed.values()) {
            boolean inserted = session.insertMention(
                    result.articleId,
                    mention.tickerId,
                    mention.mentionText,
                    mention.mentionType,
                    mention.method,
                    mention.fusedScore,
                    true
            );
            if (inserted) {
                written++;
            }
        }
        telemetry.countMentions(written);
        telemetry.endStep(RunTelemetry.STEP_PERSIST, result.confirmed.size(), written, 0);
    }

    private ProcessingRun buildRun(OffsetDateTime startedAt, RunTelemetry telemetry, RunStatus status, String note) {
        String logLine = telemetry.countersLine();
        if (note != null && !note.isBlank()) {
            logLine = logLine + " note=" + note.trim();
        }
        return ProcessingRun.builder()
                .jobType(JOB_TYPE)
                .startedAt(startedAt)
                .finishedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .newArticles(telemetry.newArticles())
                .duplicates(telemetry.duplicates())
                .failedArticles(telemetry.failedArticles())
                .mentions(telemetry.mentions())
                .status(status)
                .log(logLine)
                .build();
    }

    // The run's own session may be the thing that broke, so use a fresh one.
    private ProcessingRun recordFailedRun(ProcessingRun record) {
        try (RepositorySession fresh = repository.openSession()) {
            long runId = fresh.recordRun(record);
            return record.toBuilder().id(runId).build();
        } catch (PersistenceFailure | RuntimeException e) {
            log.error("could not record failed run: {}", e.getMessage());
            return record;
        }
    }

    private void closeSession(RepositorySession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (PersistenceFailure e) {
            log.warn("failed to close repository session: {}", e.getMessage());
        }
    }

    private List<String> methodNames() {
        List<String> names = new ArrayList<>();
        for (CandidateGenerator generator : generators) {
            names.add(generator.method().wireName());
        }
        return names;
    }

    private static ThreadFactory articleThreads() {
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "article-" + poolId + "-" + threadSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
