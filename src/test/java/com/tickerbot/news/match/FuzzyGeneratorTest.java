package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.Ticker;
import com.tickerbot.news.model.TickerDictionary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuzzyGeneratorTest {
    private final FuzzyGenerator generator = new FuzzyGenerator();
    private final PipelineSettings settings = PipelineSettings.defaults();
    private final TickerDictionary dictionary = TickerDictionary.of(List.of(
            new Ticker(1L, "GAZP", "Газпром", List.of()),
            new Ticker(2L, "SBER", "Sberbank", List.of()),
            new Ticker(3L, "NLMK", "Novolipetsk Steel", List.of("NLMK Group"))
    ));

    @Test
    void generate_shouldCatchInflectedName() {
        Map<Long, CandidateSignal> signals = generator.generate("Акции Газпрома подорожали", dictionary, settings);

        CandidateSignal signal = signals.get(1L);
        assertEquals(DetectionMethod.FUZZY, signal.method);
        assertEquals("Газпрома", signal.mentionText);
        assertTrue(signal.rawScore >= settings.getFuzzyFloor());
        assertTrue(signal.rawScore < 1.0);
    }

    @Test
    void generate_shouldCatchMisspellingAndMultiWordName() {
        assertTrue(generator.generate("Sberbnk shares rallied", dictionary, settings).containsKey(2L));
        assertTrue(generator.generate("novolipetsk steel output grew", dictionary, settings).containsKey(3L));
    }

    @Test
    void generate_shouldCapExactNameBelowOne() {
        CandidateSignal signal = generator.generate("Sberbank", dictionary, settings).get(2L);

        assertEquals(FuzzyGenerator.MAX_SCORE, signal.rawScore);
    }

    @Test
    void generate_shouldIgnoreSymbolsAndDistantWords() {
        Map<Long, CandidateSignal> signals = generator.generate("GAZP and the summer garden", dictionary, settings);

        assertFalse(signals.containsKey(1L));
        assertTrue(signals.isEmpty());
    }

    @Test
    void generate_shouldRespectFloor() {
        PipelineSettings strict = settings.toBuilder().fuzzyFloor(0.95).build();

        assertFalse(generator.generate("Акции Газпрома подорожали", dictionary, strict).containsKey(1L));
    }
}
