package com.tickerbot.news.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostgresNewsRepositoryTest {

    @Test
    void parseAliases_shouldReadJsonArray() {
        assertEquals(List.of("Сбер", "Sberbank"), PostgresNewsRepository.parseAliases("[\"Сбер\", \" Sberbank \", \"\"]", "SBER"));
    }

    @Test
    void parseAliases_shouldFallBackToCommaList() {
        assertEquals(List.of("Сбер", "Sberbank"), PostgresNewsRepository.parseAliases("Сбер, Sberbank,", "SBER"));
        assertTrue(PostgresNewsRepository.parseAliases(null, "SBER").isEmpty());
        assertTrue(PostgresNewsRepository.parseAliases("  ", "SBER").isEmpty());
    }

    @Test
    void migration_shouldEnforceHashAndMentionUniqueness() {
        List<String> statements = MigrationRunner.buildStatements();

        String articles = statements.stream().filter(s -> s.contains("TABLE IF NOT EXISTS articles")).findFirst().orElseThrow();
        String mentions = statements.stream().filter(s -> s.contains("TABLE IF NOT EXISTS article_ticker")).findFirst().orElseThrow();
        assertTrue(articles.contains("hash TEXT NOT NULL UNIQUE"));
        assertTrue(mentions.contains("UNIQUE (article_id, ticker_id)"));
        assertTrue(statements.stream().anyMatch(s -> s.contains("jobs_log")));
        assertTrue(statements.stream().anyMatch(s -> s.contains("jobs_lock")));
    }

    @Test
    void database_shouldRejectNonPostgresUrlAndMaskPassword() {
        assertThrows(IllegalArgumentException.class, () -> new Database("jdbc:mysql://localhost/x", "u", "p", "tickerbot"));
        assertThrows(IllegalArgumentException.class, () -> new Database("jdbc:postgresql://localhost/x", "u", "p", "bad-schema;"));

        Database database = new Database("jdbc:postgresql://localhost:5432/news?user=bot&password=secret", "", null, "");
        assertEquals("jdbc:postgresql://localhost:5432/news?user=bot&password=***", database.maskedJdbcUrl());
        assertEquals("tickerbot", database.schema());
    }
}
