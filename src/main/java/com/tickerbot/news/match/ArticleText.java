package com.tickerbot.news.match;

import com.tickerbot.news.model.TickerDictionary;
import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleaned article text plus its word tokens with character offsets.
 * Built once per article and shared read-only by every generator.
 */
public final class ArticleText {
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:[-'’&][\\p{L}\\p{N}]+)*");

    private final String text;
    private final List<Token> tokens;

    private ArticleText(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    public static ArticleText of(String raw) {
        String text = clean(raw);
        List<Token> tokens = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            tokens.add(new Token(m.group(), TickerDictionary.normalize(m.group()), m.start(), m.end()));
        }
        return new ArticleText(text, Collections.unmodifiableList(tokens));
    }

    static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return Jsoup.parse(raw).text()
                .replace('\u00a0', ' ')
                .replace('\u3000', ' ')
                .replaceAll("\\s+", " ")
                .trim();
    }

    public String text() {
        return text;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * Original text covered by tokens {@code [from, to)}.
     */
    public String span(int from, int to) {
        if (from < 0 || to > tokens.size() || from >= to) {
            return "";
        }
        return text.substring(tokens.get(from).start, tokens.get(to - 1).end);
    }

    /**
     * Normalized form of tokens {@code [from, to)}, words joined by single spaces.
     */
    public String normalizedSpan(int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(tokens.get(i).normalized);
        }
        return sb.toString();
    }

    public static final class Token {
        public final String text;
        public final String normalized;
        public final int start;
        public final int end;

        Token(String text, String normalized, int start, int end) {
            this.text = text;
            this.normalized = normalized;
            this.start = start;
            this.end = end;
        }
    }
}
