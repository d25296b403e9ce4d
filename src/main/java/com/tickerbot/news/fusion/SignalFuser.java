package com.tickerbot.news.fusion;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.FusedResult;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges per-method signals into one confidence per ticker.
 * <p>
 * Default policy is weighted max: {@code max(weight[method] * raw_score)}. With
 * {@link FusionMode#ADDITIVE} the weighted contributions are combined as a noisy-OR,
 * which still never decreases when a corroborating signal is added. The representative
 * mention comes from the highest weighted contribution, ties going to the more precise
 * method (substring, ner, fuzzy, semantic).
 */
public final class SignalFuser {
    private final Map<DetectionMethod, Double> weights;
    private final FusionMode mode;

    public SignalFuser(Map<DetectionMethod, Double> weights, FusionMode mode) {
        this.weights = new EnumMap<>(weights);
        this.mode = mode == null ? FusionMode.MAX : mode;
    }

    public static SignalFuser fromSettings(PipelineSettings settings) {
        return new SignalFuser(settings.getWeights(), settings.getFusionMode());
    }

    public FusionMode mode() {
        return mode;
    }

    /**
     * Empty or all-empty input yields an empty map.
     */
    public Map<Long, FusedResult> fuse(List<Map<Long, CandidateSignal>> signalsByMethod) {
        Map<Long, List<CandidateSignal>> byTicker = new TreeMap<>();
        if (signalsByMethod != null) {
            for (Map<Long, CandidateSignal> signals : signalsByMethod) {
                if (signals == null) {
                    continue;
                }
                for (CandidateSignal signal : signals.values()) {
                    if (signal != null) {
                        byTicker.computeIfAbsent(signal.tickerId, ignored -> new ArrayList<>()).add(signal);
                    }
                }
            }
        }

        Map<Long, FusedResult> out = new TreeMap<>();
        for (Map.Entry<Long, List<CandidateSignal>> entry : byTicker.entrySet()) {
            out.put(entry.getKey(), fuseTicker(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    private FusedResult fuseTicker(long tickerId, List<CandidateSignal> signals) {
        EnumMap<DetectionMethod, Double> contributions = new EnumMap<>(DetectionMethod.class);
        CandidateSignal representative = null;
        double representativeContribution = -1.0;

        for (CandidateSignal signal : signals) {
            double contribution = weight(signal.method) * signal.rawScore;
            contributions.merge(signal.method, contribution, Math::max);
            if (representative == null
                    || contribution > representativeContribution
                    || (contribution == representativeContribution
                    && signal.method.precedence() < representative.method.precedence())) {
                representative = signal;
                representativeContribution = contribution;
            }
        }

        double fused;
        if (mode == FusionMode.ADDITIVE) {
            double miss = 1.0;
            for (double contribution : contributions.values()) {
                miss *= 1.0 - clampUnit(contribution);
            }
            fused = 1.0 - miss;
        } else {
            fused = representativeContribution;
        }

        return new FusedResult(
                tickerId,
                clampUnit(fused),
                representative.mentionText,
                representative.mentionType,
                representative.method,
                contributions
        );
    }

    private double weight(DetectionMethod method) {
        Double value = weights.get(method);
        return value == null ? 0.0 : value;
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
