package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.TickerDictionary;

import java.util.Map;

/**
 * A detector that scans article text against the ticker dictionary.
 * Implementations hold no per-call mutable state and may be called concurrently.
 * At most one signal per ticker is returned; no match yields an empty map.
 */
public interface CandidateGenerator {

    DetectionMethod method();

    Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings);

    default Map<Long, CandidateSignal> generate(String text, TickerDictionary dictionary, PipelineSettings settings) {
        return generate(ArticleText.of(text), dictionary, settings);
    }
}
