package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.MentionType;
import com.tickerbot.news.model.TickerDictionary;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Whole-word, case-insensitive exact match of symbols, names and aliases.
 * Symbol hits score 1.0, name and alias hits 0.8.
 */
public final class SubstringGenerator implements CandidateGenerator {
    static final double SYMBOL_SCORE = 1.0;
    static final double NAME_SCORE = 0.8;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SUBSTRING;
    }

    @Override
    public Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings) {
        Map<Long, CandidateSignal> out = new HashMap<>();
        if (text == null || text.isEmpty() || dictionary == null) {
            return out;
        }
        String haystack = text.text();
        for (TickerDictionary.Term term : dictionary.terms()) {
            Matcher m = term.wholeWord.matcher(haystack);
            if (!m.find()) {
                continue;
            }
            double score = term.type == MentionType.SYMBOL ? SYMBOL_SCORE : NAME_SCORE;
            CandidateSignal signal = new CandidateSignal(term.tickerId, m.group(), term.type, DetectionMethod.SUBSTRING, score);
            out.merge(term.tickerId, signal, CandidateSignal::stronger);
        }
        return out;
    }
}
