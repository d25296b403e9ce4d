package com.tickerbot.news.db;

import com.tickerbot.news.db.mybatis.ArticleInsertParam;
import com.tickerbot.news.db.mybatis.ArticleMapper;
import com.tickerbot.news.db.mybatis.JobLogInsertParam;
import com.tickerbot.news.db.mybatis.JobsMapper;
import com.tickerbot.news.db.mybatis.MentionInsertParam;
import com.tickerbot.news.db.mybatis.MentionMapper;
import com.tickerbot.news.db.mybatis.MentionRecord;
import com.tickerbot.news.db.mybatis.MyBatisSupport;
import com.tickerbot.news.db.mybatis.SourceMapper;
import com.tickerbot.news.db.mybatis.TickerMapper;
import com.tickerbot.news.db.mybatis.TickerRecord;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.InsertResult;
import com.tickerbot.news.model.MentionRow;
import com.tickerbot.news.model.MentionType;
import com.tickerbot.news.model.ProcessingRun;
import com.tickerbot.news.model.StoredArticle;
import com.tickerbot.news.model.Ticker;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Repository adapter over PostgreSQL. A session owns one auto-commit connection and
 * one MyBatis session for its whole lifetime.
 */
public final class PostgresNewsRepository implements NewsRepository {
    private static final Logger log = LogManager.getLogger(PostgresNewsRepository.class);
    static final String RUN_LOCK = "pipeline";

    private final Database database;

    public PostgresNewsRepository(Database database) {
        this.database = database;
    }

    @Override
    public RepositorySession openSession() throws PersistenceFailure {
        Connection conn;
        try {
            conn = database.connect();
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            throw new PersistenceFailure("cannot open repository session: " + e.getMessage(), e);
        }
        return new Session(conn, MyBatisSupport.openSession(conn));
    }

    static List<String> parseAliases(String raw, String symbol) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        try {
            JSONArray array = new JSONArray(raw);
            for (int i = 0; i < array.length(); i++) {
                String alias = array.optString(i, "").trim();
                if (!alias.isEmpty()) {
                    out.add(alias);
                }
            }
        } catch (JSONException e) {
            log.warn("ticker {} has malformed aliases JSON, reading as comma list: {}", symbol, e.getMessage());
            for (String part : raw.split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return out;
    }

    private static final class Session implements RepositorySession {
        private final Connection conn;
        private final SqlSession sql;

        private Session(Connection conn, SqlSession sql) {
            this.conn = conn;
            this.sql = sql;
        }

        @Override
        public long ensureSource(String name) throws PersistenceFailure {
            try {
                SourceMapper mapper = sql.getMapper(SourceMapper.class);
                mapper.insertIfAbsent(name);
                Long id = mapper.findIdByName(name);
                if (id == null) {
                    throw new PersistenceFailure("source not found after insert: " + name);
                }
                return id;
            } catch (RuntimeException e) {
                throw failure("ensure source", e);
            }
        }

        @Override
        public List<Ticker> loadTickers() throws PersistenceFailure {
            try {
                List<Ticker> out = new ArrayList<>();
                for (TickerRecord row : sql.getMapper(TickerMapper.class).listTickers()) {
                    out.add(new Ticker(
                            row.getId(),
                            row.getTicker(),
                            row.getName(),
                            parseAliases(row.getAliases(), row.getTicker()),
                            row.getDescription()
                    ));
                }
                return out;
            } catch (RuntimeException e) {
                throw failure("load tickers", e);
            }
        }

        @Override
        public InsertResult insertArticleIfNew(StoredArticle article) throws PersistenceFailure {
            try {
                ArticleMapper mapper = sql.getMapper(ArticleMapper.class);
                ArticleInsertParam param = ArticleInsertParam.builder()
                        .sourceId(article.sourceId)
                        .title(article.title)
                        .body(article.body)
                        .url(article.url)
                        .publishedAt(article.publishedAt)
                        .hash(article.hash)
                        .build();
                int inserted = mapper.insertIfAbsent(param);
                if (inserted == 1 && param.getId() != null) {
                    return new InsertResult(param.getId(), true);
                }
                Long existing = mapper.findIdByHash(article.hash);
                if (existing == null) {
                    throw new PersistenceFailure("article neither inserted nor found: hash=" + article.hash);
                }
                return new InsertResult(existing, false);
            } catch (RuntimeException e) {
                throw failure("insert article", e);
            }
        }

        @Override
        public boolean insertMention(
                long articleId,
                long tickerId,
                String mentionText,
                MentionType mentionType,
                DetectionMethod method,
                double fusedScore,
                boolean confirmed
        ) throws PersistenceFailure {
            try {
                int inserted = sql.getMapper(MentionMapper.class).insertIfAbsent(MentionInsertParam.builder()
                        .articleId(articleId)
                        .tickerId(tickerId)
                        .mentionText(mentionText)
                        .mentionType(mentionType.wireName())
                        .method(method.wireName())
                        .fusedScore(fusedScore)
                        .confirmed(confirmed)
                        .build());
                return inserted == 1;
            } catch (RuntimeException e) {
                throw failure("insert mention", e);
            }
        }

        @Override
        public long recordRun(ProcessingRun run) throws PersistenceFailure {
            try {
                JobLogInsertParam row = JobLogInsertParam.builder()
                        .jobType(run.getJobType())
                        .startedAt(run.getStartedAt())
                        .finishedAt(run.getFinishedAt())
                        .newArticles(run.getNewArticles())
                        .duplicates(run.getDuplicates())
                        .failedArticles(run.getFailedArticles())
                        .mentions(run.getMentions())
                        .status(run.getStatus().wireName())
                        .log(run.getLog())
                        .build();
                sql.getMapper(JobsMapper.class).insertJobLog(row);
                return row.getId() == null ? 0L : row.getId();
            } catch (RuntimeException e) {
                throw failure("record run", e);
            }
        }

        @Override
        public List<MentionRow> mentionsForDate(LocalDate date, ZoneId zone) throws PersistenceFailure {
            OffsetDateTime from = date.atStartOfDay(zone).toOffsetDateTime();
            OffsetDateTime to = date.plusDays(1).atStartOfDay(zone).toOffsetDateTime();
            try {
                List<MentionRow> out = new ArrayList<>();
                for (MentionRecord row : sql.getMapper(MentionMapper.class).listConfirmedBetween(from, to)) {
                    out.add(new MentionRow(
                            row.getArticleId(),
                            row.getTickerId(),
                            row.getSymbol(),
                            row.getSourceId(),
                            row.getTitle(),
                            row.getUrl(),
                            row.getPublishedAt(),
                            row.getFusedScore()
                    ));
                }
                return out;
            } catch (RuntimeException e) {
                throw failure("read mentions for " + date, e);
            }
        }

        @Override
        public boolean tryAcquireRunLock(String owner, Duration staleAfter) throws PersistenceFailure {
            OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
            try {
                return sql.getMapper(JobsMapper.class).tryLock(RUN_LOCK, owner, now, now.minus(staleAfter)) == 1;
            } catch (RuntimeException e) {
                throw failure("acquire run lock", e);
            }
        }

        @Override
        public void releaseRunLock(String owner) throws PersistenceFailure {
            try {
                if (sql.getMapper(JobsMapper.class).unlock(RUN_LOCK, owner) == 0) {
                    log.warn("run lock was not held by {} at release", owner);
                }
            } catch (RuntimeException e) {
                throw failure("release run lock", e);
            }
        }

        @Override
        public void close() throws PersistenceFailure {
            try {
                sql.close();
            } finally {
                try {
                    conn.close();
                } catch (SQLException e) {
                    throw new PersistenceFailure("failed to close repository connection: " + e.getMessage(), e);
                }
            }
        }

        private PersistenceFailure failure(String operation, RuntimeException e) {
            Throwable root = e.getCause() == null ? e : e.getCause();
            return new PersistenceFailure(operation + " failed: " + root.getMessage(), e);
        }
    }
}
