package com.tickerbot.news.match;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArticleTextTest {

    @Test
    void of_shouldStripMarkupAndCollapseWhitespace() {
        ArticleText text = ArticleText.of("<p>Акции&nbsp;<b>GAZP</b>\n\n выросли</p><script>x()</script>");

        assertEquals("Акции GAZP выросли", text.text());
        assertEquals("GAZP", text.tokens().get(1).text);
    }

    @Test
    void tokens_shouldKeepHyphenatedWordsAndOffsets() {
        ArticleText text = ArticleText.of("Банк ВТБ-Капитал и Johnson & Johnson");

        assertEquals("ВТБ-Капитал", text.tokens().get(1).text);
        assertEquals("ВТБ-Капитал и", text.span(1, 3));
        assertEquals("втб капитал и", text.normalizedSpan(1, 3));
        assertEquals("", text.span(2, 2));
    }

    @Test
    void of_shouldHandleBlankInput() {
        assertTrue(ArticleText.of(null).isEmpty());
        assertTrue(ArticleText.of("  \n ").tokens().isEmpty());
    }
}
