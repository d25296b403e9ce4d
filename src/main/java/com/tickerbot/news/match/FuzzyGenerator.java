package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.MentionType;
import com.tickerbot.news.model.TickerDictionary;

import java.util.HashMap;
import java.util.Map;

/**
 * Approximate match of token n-grams against ticker names and aliases.
 * Catches inflected and misspelled forms ("Газпрома", "Sberbnak"). Scores are the
 * similarity itself, kept below 1.0 so exact evidence stays with the substring generator.
 */
public final class FuzzyGenerator implements CandidateGenerator {
    static final double MAX_SCORE = 0.99;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.FUZZY;
    }

    @Override
    public Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings) {
        Map<Long, CandidateSignal> out = new HashMap<>();
        if (text == null || text.tokens().isEmpty() || dictionary == null) {
            return out;
        }
        double floor = settings.getFuzzyFloor();
        int minLength = settings.getFuzzyMinTermLength();
        int tokenCount = text.tokens().size();

        for (TickerDictionary.Term term : dictionary.terms()) {
            if (term.type == MentionType.SYMBOL || term.normalized.length() < minLength) {
                continue;
            }
            int termWords = term.normalized.split(" ").length;
            CandidateSignal best = out.get(term.tickerId);
            for (int n = Math.max(1, termWords - 1); n <= termWords + 1; n++) {
                for (int from = 0; from + n <= tokenCount; from++) {
                    String candidate = text.normalizedSpan(from, from + n);
                    if (!withinLengthBudget(candidate, term.normalized, floor)) {
                        continue;
                    }
                    double similarity = TextSimilarity.similarity(candidate, term.normalized);
                    if (similarity < floor) {
                        continue;
                    }
                    double score = Math.min(MAX_SCORE, similarity);
                    CandidateSignal signal = new CandidateSignal(
                            term.tickerId, text.span(from, from + n), term.type, DetectionMethod.FUZZY, score);
                    best = CandidateSignal.stronger(best, signal);
                }
            }
            if (best != null) {
                out.put(term.tickerId, best);
            }
        }
        return out;
    }

    // Edit distance is at least the length difference, so longer gaps can never reach the floor.
    private boolean withinLengthBudget(String candidate, String term, double floor) {
        int longer = Math.max(candidate.length(), term.length());
        int gap = Math.abs(candidate.length() - term.length());
        return gap <= (1.0 - floor) * longer;
    }
}
