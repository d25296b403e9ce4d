package com.tickerbot.news.config;

import com.tickerbot.news.fusion.FusionMode;
import com.tickerbot.news.model.DetectionMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed, validated view of the pipeline options.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {
    @Builder.Default
    boolean substringEnabled = true;
    @Builder.Default
    boolean fuzzyEnabled = true;
    @Builder.Default
    boolean nerEnabled = true;
    @Builder.Default
    boolean semanticEnabled = false;

    @Builder.Default
    Map<DetectionMethod, Double> weights = defaultWeights();
    @Builder.Default
    FusionMode fusionMode = FusionMode.MAX;
    @Builder.Default
    double confirmThreshold = 0.75;

    @Builder.Default
    int generatorConcurrency = 4;
    @Builder.Default
    long generatorTimeoutMs = 5000L;
    @Builder.Default
    int articleConcurrency = 4;

    @Builder.Default
    double fuzzyFloor = 0.75;
    @Builder.Default
    int fuzzyMinTermLength = 4;
    @Builder.Default
    double nerResolveFloor = 0.8;
    @Builder.Default
    boolean nerLlmEnabled = false;
    @Builder.Default
    double semanticFloor = 0.6;
    @Builder.Default
    int semanticWindowChars = 600;
    @Builder.Default
    int semanticMaxWindows = 8;

    @Builder.Default
    boolean lockEnabled = true;
    @Builder.Default
    long lockStaleMinutes = 60L;

    @Builder.Default
    ZoneId summaryZone = ZoneId.of("Europe/Moscow");
    @Builder.Default
    int summaryTopN = 5;

    public static PipelineSettings defaults() {
        return PipelineSettings.builder().build();
    }

    public static Map<DetectionMethod, Double> defaultWeights() {
        EnumMap<DetectionMethod, Double> weights = new EnumMap<>(DetectionMethod.class);
        weights.put(DetectionMethod.SUBSTRING, 1.0);
        weights.put(DetectionMethod.FUZZY, 0.8);
        weights.put(DetectionMethod.NER, 0.9);
        weights.put(DetectionMethod.SEMANTIC, 0.7);
        return Collections.unmodifiableMap(weights);
    }

    public static PipelineSettings fromConfig(Config config) {
        EnumMap<DetectionMethod, Double> weights = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : DetectionMethod.values()) {
            weights.put(method, doubleValue(config, "pipeline.fusion.weight." + method.wireName()));
        }
        FusionMode mode;
        try {
            mode = FusionMode.parse(config.getString("pipeline.fusion.mode"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("pipeline.fusion.mode must be max or additive, got '"
                    + config.getString("pipeline.fusion.mode") + "'", e);
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(config.getString("summary.zone"));
        } catch (RuntimeException e) {
            throw new ConfigurationException("summary.zone is not a valid zone id: " + config.getString("summary.zone"), e);
        }

        PipelineSettings settings = PipelineSettings.builder()
                .substringEnabled(config.getBoolean("pipeline.generator.substring.enabled", true))
                .fuzzyEnabled(config.getBoolean("pipeline.generator.fuzzy.enabled", true))
                .nerEnabled(config.getBoolean("pipeline.generator.ner.enabled", true))
                .semanticEnabled(config.getBoolean("pipeline.generator.semantic.enabled", false))
                .weights(Collections.unmodifiableMap(weights))
                .fusionMode(mode)
                .confirmThreshold(doubleValue(config, "pipeline.confirm.threshold"))
                .generatorConcurrency(intValue(config, "pipeline.generator.concurrency"))
                .generatorTimeoutMs(longValue(config, "pipeline.generator.timeout-ms"))
                .articleConcurrency(intValue(config, "pipeline.article.concurrency"))
                .fuzzyFloor(doubleValue(config, "pipeline.fuzzy.floor"))
                .fuzzyMinTermLength(intValue(config, "pipeline.fuzzy.min-term-length"))
                .nerResolveFloor(doubleValue(config, "pipeline.ner.resolve-floor"))
                .nerLlmEnabled(config.getBoolean("pipeline.ner.llm.enabled", false))
                .semanticFloor(doubleValue(config, "pipeline.semantic.floor"))
                .semanticWindowChars(intValue(config, "pipeline.semantic.window-chars"))
                .semanticMaxWindows(intValue(config, "pipeline.semantic.max-windows"))
                .lockEnabled(config.getBoolean("pipeline.lock.enabled", true))
                .lockStaleMinutes(longValue(config, "pipeline.lock.stale-minutes"))
                .summaryZone(zone)
                .summaryTopN(intValue(config, "summary.top-n"))
                .build();
        settings.validate();
        return settings;
    }

    public boolean isEnabled(DetectionMethod method) {
        switch (method) {
            case SUBSTRING:
                return substringEnabled;
            case FUZZY:
                return fuzzyEnabled;
            case NER:
                return nerEnabled;
            case SEMANTIC:
                return semanticEnabled;
            default:
                return false;
        }
    }

    public double weight(DetectionMethod method) {
        Double value = weights.get(method);
        return value == null ? 0.0 : value;
    }

    public Duration generatorTimeout() {
        return Duration.ofMillis(generatorTimeoutMs);
    }

    public Duration lockStaleAfter() {
        return Duration.ofMinutes(lockStaleMinutes);
    }

    /**
     * Fails fast on values the pipeline cannot run with.
     *
     * @throws ConfigurationException naming the first offending option
     */
    public PipelineSettings validate() {
        requireUnit("pipeline.confirm.threshold", confirmThreshold);
        if (weights == null) {
            throw new ConfigurationException("pipeline.fusion.weight.* must be set");
        }
        for (DetectionMethod method : DetectionMethod.values()) {
            Double weight = weights.get(method);
            if (weight == null) {
                throw new ConfigurationException("pipeline.fusion.weight." + method.wireName() + " is missing");
            }
            requireUnit("pipeline.fusion.weight." + method.wireName(), weight);
        }
        if (fusionMode == null) {
            throw new ConfigurationException("pipeline.fusion.mode must be set");
        }
        requirePositive("pipeline.generator.concurrency", generatorConcurrency);
        requirePositive("pipeline.generator.timeout-ms", generatorTimeoutMs);
        requirePositive("pipeline.article.concurrency", articleConcurrency);
        requireOpenUnit("pipeline.fuzzy.floor", fuzzyFloor);
        requirePositive("pipeline.fuzzy.min-term-length", fuzzyMinTermLength);
        requireOpenUnit("pipeline.ner.resolve-floor", nerResolveFloor);
        requireOpenUnit("pipeline.semantic.floor", semanticFloor);
        requirePositive("pipeline.semantic.window-chars", semanticWindowChars);
        requirePositive("pipeline.semantic.max-windows", semanticMaxWindows);
        requirePositive("pipeline.lock.stale-minutes", lockStaleMinutes);
        if (summaryTopN < 0) {
            throw new ConfigurationException("summary.top-n must be >= 0, got " + summaryTopN);
        }
        if (summaryZone == null) {
            throw new ConfigurationException("summary.zone must be set");
        }
        return this;
    }

    private static void requireUnit(String key, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(key + " must be within [0, 1], got " + value);
        }
    }

    private static void requireOpenUnit(String key, double value) {
        if (Double.isNaN(value) || value <= 0.0 || value >= 1.0) {
            throw new ConfigurationException(key + " must be within (0, 1), got " + value);
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0L) {
            throw new ConfigurationException(key + " must be > 0, got " + value);
        }
    }

    private static double doubleValue(Config config, String key) {
        String raw = config.getString(key);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: '" + raw + "'", e);
        }
    }

    private static int intValue(Config config, String key) {
        String raw = config.getString(key);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: '" + raw + "'", e);
        }
    }

    private static long longValue(Config config, String key) {
        String raw = config.getString(key);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: '" + raw + "'", e);
        }
    }
}
