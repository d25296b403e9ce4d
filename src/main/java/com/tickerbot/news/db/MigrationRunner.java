package com.tickerbot.news.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent schema setup. Safe to run on every start.
 */
public final class MigrationRunner {
    private static final Logger log = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + e.getMessage();
                log.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                log.info("schema migrated: schema={} version {} -> {}", schema, currentVersion, TARGET_VERSION);
            }
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS sources (" +
                "id BIGSERIAL PRIMARY KEY," +
                "name TEXT NOT NULL UNIQUE," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS tickers (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL UNIQUE," +
                "name TEXT NULL," +
                "aliases TEXT NOT NULL DEFAULT '[]'," +
                "isin TEXT NULL," +
                "exchange TEXT NULL," +
                "description TEXT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS articles (" +
                "id BIGSERIAL PRIMARY KEY," +
                "source_id BIGINT NOT NULL REFERENCES sources(id)," +
                "title TEXT NOT NULL," +
                "body TEXT NULL," +
                "url TEXT NOT NULL," +
                "published_at TIMESTAMPTZ NULL," +
                "hash TEXT NOT NULL UNIQUE," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_articles_published_at ON articles(published_at)");

        sqls.add("CREATE TABLE IF NOT EXISTS article_ticker (" +
                "id BIGSERIAL PRIMARY KEY," +
                "article_id BIGINT NOT NULL REFERENCES articles(id) ON DELETE CASCADE," +
                "ticker_id BIGINT NOT NULL REFERENCES tickers(id)," +
                "mention_text TEXT NOT NULL," +
                "mention_type TEXT NOT NULL," +
                "method TEXT NOT NULL," +
                "fused_score DOUBLE PRECISION NOT NULL," +
                "confirmed BOOLEAN NOT NULL DEFAULT TRUE," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (article_id, ticker_id)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_article_ticker_ticker ON article_ticker(ticker_id)");

        sqls.add("CREATE TABLE IF NOT EXISTS jobs_log (" +
                "id BIGSERIAL PRIMARY KEY," +
                "job_type TEXT NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NULL," +
                "new_articles INTEGER NOT NULL DEFAULT 0," +
                "duplicates INTEGER NOT NULL DEFAULT 0," +
                "failed_articles INTEGER NOT NULL DEFAULT 0," +
                "mentions INTEGER NOT NULL DEFAULT 0," +
                "status TEXT NOT NULL," +
                "log TEXT NULL" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS jobs_lock (" +
                "lock_name TEXT PRIMARY KEY," +
                "owner TEXT NOT NULL," +
                "acquired_at TIMESTAMPTZ NOT NULL" +
                ")");

        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && !value.trim().isEmpty()) {
                    return Integer.parseInt(value.trim());
                }
            }
        } catch (SQLException | NumberFormatException e) {
            log.warn("could not read schema_version, assuming 0: {}", e.getMessage());
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}
