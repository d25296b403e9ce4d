package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.MentionType;
import com.tickerbot.news.model.Ticker;
import com.tickerbot.news.model.TickerDictionary;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.CosineSimilarity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cosine similarity between article windows and each ticker's descriptive text.
 * Ticker embeddings are cached by descriptive text for the lifetime of the generator.
 */
public final class SemanticGenerator implements CandidateGenerator {
    static final double MAX_SCORE = 0.99;
    private static final int SNIPPET_CHARS = 120;

    private final EmbeddingModel embeddingModel;
    private final Map<String, Embedding> tickerEmbeddings = new ConcurrentHashMap<>();

    public SemanticGenerator(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEMANTIC;
    }

    @Override
    public Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings) {
        Map<Long, CandidateSignal> out = new HashMap<>();
        if (text == null || text.isEmpty() || dictionary == null || dictionary.isEmpty()) {
            return out;
        }
        if (embeddingModel == null) {
            throw new GeneratorFailure(DetectionMethod.SEMANTIC, "embedding model unavailable");
        }
        List<String> windows = windows(text.text(), settings.getSemanticWindowChars(), settings.getSemanticMaxWindows());
        List<Embedding> windowVectors = embed(windows);
        ensureTickerEmbeddings(dictionary);

        double floor = settings.getSemanticFloor();
        for (Ticker ticker : dictionary.tickers()) {
            Embedding tickerVector = tickerEmbeddings.get(ticker.descriptiveText());
            if (tickerVector == null) {
                continue;
            }
            double best = -1.0;
            int bestWindow = -1;
            for (int i = 0; i < windowVectors.size(); i++) {
                double similarity = CosineSimilarity.between(windowVectors.get(i), tickerVector);
                if (similarity > best) {
                    best = similarity;
                    bestWindow = i;
                }
            }
            if (bestWindow < 0 || best < floor) {
                continue;
            }
            out.put(ticker.id, new CandidateSignal(
                    ticker.id,
                    snippet(windows.get(bestWindow)),
                    MentionType.NAME,
                    DetectionMethod.SEMANTIC,
                    Math.min(MAX_SCORE, best)
            ));
        }
        return out;
    }

    int cachedTickerEmbeddings() {
        return tickerEmbeddings.size();
    }

    private void ensureTickerEmbeddings(TickerDictionary dictionary) {
        List<String> missing = new ArrayList<>();
        for (Ticker ticker : dictionary.tickers()) {
            String key = ticker.descriptiveText();
            if (!tickerEmbeddings.containsKey(key) && !missing.contains(key)) {
                missing.add(key);
            }
        }
        if (missing.isEmpty()) {
            return;
        }
        List<Embedding> vectors = embed(missing);
        for (int i = 0; i < missing.size(); i++) {
            tickerEmbeddings.putIfAbsent(missing.get(i), vectors.get(i));
        }
    }

    private List<Embedding> embed(List<String> texts) {
        List<TextSegment> segments = new ArrayList<>(texts.size());
        for (String text : texts) {
            segments.add(TextSegment.from(text));
        }
        Response<List<Embedding>> response;
        try {
            response = embeddingModel.embedAll(segments);
        } catch (RuntimeException e) {
            throw new GeneratorFailure(DetectionMethod.SEMANTIC, "embedding call failed: " + e.getMessage(), e);
        }
        List<Embedding> vectors = response == null ? null : response.content();
        if (vectors == null || vectors.size() != texts.size()) {
            throw new GeneratorFailure(DetectionMethod.SEMANTIC, "embedding service returned "
                    + (vectors == null ? "nothing" : vectors.size() + " vectors") + " for " + texts.size() + " inputs");
        }
        return vectors;
    }

    /**
     * Splits text into windows of at most {@code windowChars}, breaking on whitespace.
     */
    static List<String> windows(String text, int windowChars, int maxWindows) {
        List<String> out = new ArrayList<>();
        int start = 0;
        while (out.size() < maxWindows) {
            while (start < text.length() && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            if (start >= text.length()) {
                break;
            }
            int end = Math.min(text.length(), start + windowChars);
            if (end < text.length()) {
                int space = text.lastIndexOf(' ', end);
                if (space > start) {
                    end = space;
                }
            }
            String window = text.substring(start, end).trim();
            if (!window.isEmpty()) {
                out.add(window);
            }
            start = end;
        }
        return out;
    }

    private static String snippet(String window) {
        return window.length() <= SNIPPET_CHARS ? window : window.substring(0, SNIPPET_CHARS).trim();
    }
}
