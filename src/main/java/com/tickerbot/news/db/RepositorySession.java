package com.tickerbot.news.db;

import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.InsertResult;
import com.tickerbot.news.model.MentionRow;
import com.tickerbot.news.model.MentionType;
import com.tickerbot.news.model.ProcessingRun;
import com.tickerbot.news.model.StoredArticle;
import com.tickerbot.news.model.Ticker;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * One connection-scoped unit of repository work. Every write is committed when the
 * call returns, so rows written before a failure or cancellation stay stored.
 * Not thread-safe: a session is used from a single coordinating thread.
 */
public interface RepositorySession extends AutoCloseable {

    /**
     * Returns the id of the named source, creating it on first use.
     */
    long ensureSource(String name) throws PersistenceFailure;

    List<Ticker> loadTickers() throws PersistenceFailure;

    /**
     * Inserts the article unless its hash is already stored. The hash uniqueness
     * check is atomic in the store; a collision is a no-op, never a second row.
     */
    InsertResult insertArticleIfNew(StoredArticle article) throws PersistenceFailure;

    /**
     * @return false when a mention for the same (article, ticker) pair already exists
     */
    boolean insertMention(
            long articleId,
            long tickerId,
            String mentionText,
            MentionType mentionType,
            DetectionMethod method,
            double fusedScore,
            boolean confirmed
    ) throws PersistenceFailure;

    long recordRun(ProcessingRun run) throws PersistenceFailure;

    /**
     * Confirmed mentions of articles published within {@code date} in {@code zone}.
     */
    List<MentionRow> mentionsForDate(LocalDate date, ZoneId zone) throws PersistenceFailure;

    /**
     * Takes the application-wide run lock. A lock held longer than {@code staleAfter}
     * is taken over.
     */
    boolean tryAcquireRunLock(String owner, Duration staleAfter) throws PersistenceFailure;

    void releaseRunLock(String owner) throws PersistenceFailure;

    @Override
    void close() throws PersistenceFailure;
}
