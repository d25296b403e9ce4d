package com.tickerbot.news.match;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based organization extraction: quoted names, legal-form markers
 * (ПАО, ОАО, АО, ООО, Inc, Corp, Group, ...) and runs of capitalized words.
 */
public final class PatternEntityExtractor implements EntityExtractor {
    private static final String CAP_WORD = "\\p{Lu}[\\p{L}\\p{N}&.'-]*";
    private static final String CAP_PHRASE = CAP_WORD + "(?:\\s+" + CAP_WORD + "){0,3}";

    private static final Pattern QUOTED = Pattern.compile("[«\"“]([^»\"”]{2,80})[»\"”]");
    private static final Pattern LEGAL_PREFIX = Pattern.compile(
            "(?<![\\p{L}])(?:ПАО|ОАО|ЗАО|АО|ООО|НК|ГК|МКПАО|Банк)\\s+[«\"“]?(" + CAP_PHRASE + ")");
    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "(" + CAP_PHRASE + ")\\s*,?\\s+(?:Inc|Corp|Corporation|Group|Ltd|PLC|AG|SA|LLC|Holding|Holdings|Co)\\b\\.?");
    private static final Pattern CAPITALIZED = Pattern.compile("(?<![\\p{L}\\p{N}])(" + CAP_PHRASE + ")");

    private static final int MIN_SPAN_LENGTH = 2;

    @Override
    public List<String> extractOrganizations(ArticleText text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String value = text.text();
        Set<String> spans = new LinkedHashSet<>();
        collect(QUOTED, value, spans);
        collect(LEGAL_PREFIX, value, spans);
        collect(LEGAL_SUFFIX, value, spans);
        collect(CAPITALIZED, value, spans);
        return new ArrayList<>(spans);
    }

    private void collect(Pattern pattern, String text, Set<String> sink) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String span = m.group(1).trim();
            if (span.endsWith(".")) {
                span = span.substring(0, span.length() - 1);
            }
            if (span.length() >= MIN_SPAN_LENGTH) {
                sink.add(span);
            }
        }
    }
}
