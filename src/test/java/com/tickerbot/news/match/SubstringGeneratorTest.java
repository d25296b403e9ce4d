package com.tickerbot.news.match;

import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.MentionType;
import com.tickerbot.news.model.Ticker;
import com.tickerbot.news.model.TickerDictionary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubstringGeneratorTest {
    private final SubstringGenerator generator = new SubstringGenerator();
    private final PipelineSettings settings = PipelineSettings.defaults();
    private final TickerDictionary dictionary = TickerDictionary.of(List.of(
            new Ticker(1L, "GAZP", "Газпром", List.of("Gazprom")),
            new Ticker(2L, "SBER", "Сбербанк", List.of("Сбер", "Sberbank"))
    ));

    @Test
    void generate_shouldScoreSymbolHitAsOne() {
        Map<Long, CandidateSignal> signals = generator.generate("Акции GAZP выросли на 3%", dictionary, settings);

        assertEquals(1, signals.size());
        CandidateSignal signal = signals.get(1L);
        assertEquals(1.0, signal.rawScore);
        assertEquals(MentionType.SYMBOL, signal.mentionType);
        assertEquals(DetectionMethod.SUBSTRING, signal.method);
        assertEquals("GAZP", signal.mentionText);
    }

    @Test
    void generate_shouldScoreNameAndAliasHitsLower() {
        Map<Long, CandidateSignal> signals = generator.generate("Sberbank reported record profit", dictionary, settings);

        assertEquals(0.8, signals.get(2L).rawScore);
        assertEquals(MentionType.ALIAS, signals.get(2L).mentionType);
    }

    @Test
    void generate_shouldKeepStrongestSignalPerTicker() {
        Map<Long, CandidateSignal> signals = generator.generate("Газпром (GAZP) сообщил о выплате", dictionary, settings);

        assertEquals(1, signals.size());
        assertEquals(MentionType.SYMBOL, signals.get(1L).mentionType);
        assertEquals(1.0, signals.get(1L).rawScore);
    }

    @Test
    void generate_shouldMatchCaseInsensitiveOnWholeWordsOnly() {
        assertTrue(generator.generate("gazp closed higher", dictionary, settings).containsKey(1L));
        assertFalse(generator.generate("SBERX fund rebalanced", dictionary, settings).containsKey(2L));
        assertFalse(generator.generate("Акции Газпрома подорожали", dictionary, settings).containsKey(1L));
    }

    @Test
    void generate_shouldReturnEmptyMapWhenNothingMatches() {
        assertTrue(generator.generate("Weather is fine today", dictionary, settings).isEmpty());
        assertTrue(generator.generate("", dictionary, settings).isEmpty());
        assertTrue(generator.generate("GAZP", TickerDictionary.empty(), settings).isEmpty());
    }
}
