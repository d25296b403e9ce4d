package com.tickerbot.news.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of the ticker reference data, taken once per run and shared by
 * every generator without locking. Each ticker's symbol, name and aliases are
 * precompiled into whole-word, case-insensitive patterns.
 */
public final class TickerDictionary {
    private final Map<Long, Ticker> byId;
    private final List<Term> terms;

    private TickerDictionary(Map<Long, Ticker> byId, List<Term> terms) {
        this.byId = byId;
        this.terms = terms;
    }

    public static TickerDictionary of(Collection<Ticker> tickers) {
        Map<Long, Ticker> byId = new LinkedHashMap<>();
        List<Term> terms = new ArrayList<>();
        if (tickers != null) {
            for (Ticker ticker : tickers) {
                if (ticker == null || byId.containsKey(ticker.id)) {
                    continue;
                }
                byId.put(ticker.id, ticker);
                addTerm(terms, ticker, ticker.symbol, MentionType.SYMBOL);
                addTerm(terms, ticker, ticker.name, MentionType.NAME);
                for (String alias : ticker.aliases) {
                    addTerm(terms, ticker, alias, MentionType.ALIAS);
                }
            }
        }
        return new TickerDictionary(Collections.unmodifiableMap(byId), Collections.unmodifiableList(terms));
    }

    public static TickerDictionary empty() {
        return of(List.of());
    }

    private static void addTerm(List<Term> terms, Ticker ticker, String text, MentionType type) {
        if (text == null || text.isBlank()) {
            return;
        }
        terms.add(new Term(ticker.id, text.trim(), type));
    }

    public Ticker get(long tickerId) {
        return byId.get(tickerId);
    }

    public Collection<Ticker> tickers() {
        return byId.values();
    }

    public List<Term> terms() {
        return terms;
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    /**
     * A matchable surface form of one ticker.
     */
    public static final class Term {
        public final long tickerId;
        public final String text;
        public final String normalized;
        public final MentionType type;
        public final Pattern wholeWord;

        Term(long tickerId, String text, MentionType type) {
            this.tickerId = tickerId;
            this.text = text;
            this.normalized = normalize(text);
            this.type = type;
            this.wholeWord = Pattern.compile(
                    "(?<![\\p{L}\\p{N}])" + Pattern.quote(text) + "(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            );
        }
    }

    /**
     * Lower-cases and collapses punctuation and whitespace, for similarity comparison.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT).replace('ё', 'е');
        return lowered.replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
    }
}
