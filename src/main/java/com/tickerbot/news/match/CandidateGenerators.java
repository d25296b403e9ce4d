package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.DetectionMethod;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the generator set selected by configuration.
 */
public final class CandidateGenerators {

    private CandidateGenerators() {
    }

    /**
     * @param chatModel      used for NER when {@code pipeline.ner.llm.enabled}; may be null
     * @param embeddingModel used by the semantic generator; may be null, which makes it degrade
     */
    public static List<CandidateGenerator> enabled(
            PipelineSettings settings,
            ChatLanguageModel chatModel,
            EmbeddingModel embeddingModel
    ) {
        List<CandidateGenerator> out = new ArrayList<>();
        for (DetectionMethod method : DetectionMethod.values()) {
            if (settings.isEnabled(method)) {
                out.add(create(method, settings, chatModel, embeddingModel));
            }
        }
        return out;
    }

    static CandidateGenerator create(
            DetectionMethod method,
            PipelineSettings settings,
            ChatLanguageModel chatModel,
            EmbeddingModel embeddingModel
    ) {
        switch (method) {
            case SUBSTRING:
                return new SubstringGenerator();
            case FUZZY:
                return new FuzzyGenerator();
            case NER:
                EntityExtractor extractor = settings.isNerLlmEnabled()
                        ? new LlmEntityExtractor(chatModel)
                        : new PatternEntityExtractor();
                return new NerGenerator(extractor);
            case SEMANTIC:
                return new SemanticGenerator(embeddingModel);
            default:
                throw new IllegalArgumentException("unknown detection method: " + method);
        }
    }
}
