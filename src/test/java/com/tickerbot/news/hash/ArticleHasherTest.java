package com.tickerbot.news.hash;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArticleHasherTest {

    @Test
    void fingerprint_shouldMatchForSameInputAndDifferPerUrl() {
        assertEquals(
                ArticleHasher.fingerprint("Title", "https://example.com"),
                ArticleHasher.fingerprint("Title", "https://example.com")
        );
        assertNotEquals(
                ArticleHasher.fingerprint("Title", "https://example.com/a"),
                ArticleHasher.fingerprint("Title", "https://example.com/b")
        );
    }

    @Test
    void fingerprint_shouldBeStableForSameTitleAndUrl() {
        String first = ArticleHasher.fingerprint("Газпром увеличил добычу", "https://example.ru/a/1");
        String second = ArticleHasher.fingerprint("Газпром увеличил добычу", "https://example.ru/a/1");

        assertEquals(first, second);
        assertEquals(64, first.length());
        assertTrue(first.matches("[0-9a-f]{64}"));
    }

    @Test
    void fingerprint_shouldIgnoreSurroundingWhitespace() {
        assertEquals(
                ArticleHasher.fingerprint("Sber raises dividend", "https://example.com/sber"),
                ArticleHasher.fingerprint("  Sber raises dividend\n", " https://example.com/sber  ")
        );
    }

    @Test
    void fingerprint_shouldDifferWhenTitleOrUrlDiffers() {
        String base = ArticleHasher.fingerprint("Sber raises dividend", "https://example.com/sber");

        assertNotEquals(base, ArticleHasher.fingerprint("Sber raises dividends", "https://example.com/sber"));
        assertNotEquals(base, ArticleHasher.fingerprint("Sber raises dividend", "https://example.com/sber?p=2"));
        assertNotEquals(base, ArticleHasher.fingerprint("sber raises dividend", "https://example.com/sber"));
    }

    @Test
    void fingerprint_shouldNotShiftFieldBoundary() {
        assertNotEquals(
                ArticleHasher.fingerprint("a\nb", "c"),
                ArticleHasher.fingerprint("a", "b\nc")
        );
    }

    @Test
    void fingerprint_shouldTreatNullAsEmpty() {
        assertEquals(ArticleHasher.fingerprint(null, null), ArticleHasher.fingerprint("", "  "));
    }
}
