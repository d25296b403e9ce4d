package com.tickerbot.news.input;

import com.tickerbot.news.model.RawArticle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RawArticleReaderTest {
    private final RawArticleReader reader = new RawArticleReader();

    @Test
    void parse_shouldReadFieldsAndSkipIncompleteEntries() {
        String json = "["
                + "{\"title\":\"Акции GAZP выросли\",\"url\":\"https://example.ru/1\","
                + "\"published_at\":\"2024-05-01T09:30:00+03:00\",\"body\":\"<p>Текст</p>\",\"source_id\":3},"
                + "{\"title\":\"No url\"},"
                + "\"not an object\","
                + "{\"title\":\"Sber\",\"url\":\"https://example.com/2\",\"summary\":\"short\","
                + "\"source\":\"reuters\",\"published_at\":\"2024-05-01T10:00:00\"}"
                + "]";

        List<RawArticle> articles = reader.parse(json);

        assertEquals(2, articles.size());
        RawArticle first = articles.get(0);
        assertEquals("Акции GAZP выросли", first.title);
        assertEquals(3L, first.sourceId);
        assertEquals(OffsetDateTime.parse("2024-05-01T09:30:00+03:00"), first.publishedAt);
        assertEquals("<p>Текст</p>", first.body);

        RawArticle second = articles.get(1);
        assertNull(second.sourceId);
        assertEquals("reuters", second.sourceName);
        assertEquals("short", second.body);
        assertEquals(OffsetDateTime.parse("2024-05-01T10:00:00Z"), second.publishedAt);
    }

    @Test
    void parse_shouldKeepArticleWithUnparseableDate() {
        List<RawArticle> articles = reader.parse(
                "[{\"title\":\"t\",\"url\":\"https://example.com\",\"published_at\":\"yesterday\"}]");

        assertEquals(1, articles.size());
        assertNull(articles.get(0).publishedAt);
    }

    @Test
    void read_shouldReportMalformedFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("batch.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> reader.read(file));
    }
}
