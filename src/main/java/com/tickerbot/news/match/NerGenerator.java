package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.MentionType;
import com.tickerbot.news.model.TickerDictionary;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves extracted organization spans against ticker names, aliases and symbols.
 * Resolution similarity at or above the floor maps linearly onto [0.5, 0.95].
 */
public final class NerGenerator implements CandidateGenerator {
    static final double MIN_SCORE = 0.5;
    static final double MAX_SCORE = 0.95;
    static final double CONTAINMENT_SIMILARITY = 0.9;

    private final EntityExtractor extractor;

    public NerGenerator(EntityExtractor extractor) {
        this.extractor = extractor;
    }

    public NerGenerator() {
        this(new PatternEntityExtractor());
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.NER;
    }

    @Override
    public Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings) {
        Map<Long, CandidateSignal> out = new HashMap<>();
        if (text == null || text.isEmpty() || dictionary == null || dictionary.isEmpty()) {
            return out;
        }
        double floor = settings.getNerResolveFloor();
        List<String> spans = extractor.extractOrganizations(text);
        for (String span : spans) {
            String normalizedSpan = TickerDictionary.normalize(span);
            if (normalizedSpan.isEmpty()) {
                continue;
            }
            for (TickerDictionary.Term term : dictionary.terms()) {
                double similarity = resolve(normalizedSpan, term);
                if (similarity < floor) {
                    continue;
                }
                double score = MIN_SCORE + (MAX_SCORE - MIN_SCORE) * (similarity - floor) / (1.0 - floor);
                score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
                CandidateSignal signal = new CandidateSignal(term.tickerId, span, term.type, DetectionMethod.NER, score);
                out.merge(term.tickerId, signal, CandidateSignal::stronger);
            }
        }
        return out;
    }

    private double resolve(String normalizedSpan, TickerDictionary.Term term) {
        if (term.normalized.isEmpty()) {
            return 0.0;
        }
        if (term.type == MentionType.SYMBOL) {
            // Symbols are short codes; only an exact span counts.
            return normalizedSpan.equals(term.normalized) ? 1.0 : 0.0;
        }
        double similarity = TextSimilarity.similarity(normalizedSpan, term.normalized);
        if (similarity < CONTAINMENT_SIMILARITY
                && Math.min(normalizedSpan.length(), term.normalized.length()) >= 4
                && TextSimilarity.wordContainment(normalizedSpan, term.normalized)) {
            similarity = CONTAINMENT_SIMILARITY;
        }
        return similarity;
    }
}
