package com.tickerbot.news.match;

import com.tickerbot.news.config.Config;
import com.tickerbot.news.config.PipelineSettings;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Ollama-backed LangChain4j models for the NER and semantic generators. A model that
 * cannot be built is left null; the generator using it then degrades per article.
 */
public final class LangChainModels {
    private static final Logger log = LogManager.getLogger(LangChainModels.class);

    private LangChainModels() {
    }

    public static List<CandidateGenerator> generators(Config config, PipelineSettings settings) {
        ChatLanguageModel chatModel = settings.isNerEnabled() && settings.isNerLlmEnabled() ? chatModel(config) : null;
        EmbeddingModel embeddingModel = settings.isSemanticEnabled() ? embeddingModel(config) : null;
        return CandidateGenerators.enabled(settings, chatModel, embeddingModel);
    }

    public static ChatLanguageModel chatModel(Config config) {
        try {
            return OllamaChatModel.builder()
                    .baseUrl(config.getString("ai.base-url"))
                    .modelName(config.getString("ai.chat-model"))
                    .temperature(config.getDouble("ai.temperature", 0.0))
                    .timeout(timeout(config))
                    .build();
        } catch (RuntimeException e) {
            log.warn("failed to initialize Ollama chat model, LLM entity extraction will degrade: {}", e.getMessage());
            return null;
        }
    }

    public static EmbeddingModel embeddingModel(Config config) {
        try {
            return OllamaEmbeddingModel.builder()
                    .baseUrl(config.getString("ai.base-url"))
                    .modelName(config.getString("ai.embed-model"))
                    .timeout(timeout(config))
                    .build();
        } catch (RuntimeException e) {
            log.warn("failed to initialize Ollama embedding model, semantic matching will degrade: {}", e.getMessage());
            return null;
        }
    }

    private static Duration timeout(Config config) {
        return Duration.ofSeconds(Math.max(5, config.getInt("ai.timeout-sec", 60)));
    }
}
