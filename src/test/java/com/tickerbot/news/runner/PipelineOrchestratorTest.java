package com.tickerbot.news.runner;

import com.tickerbot.news.config.ConfigurationException;
import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.db.InMemoryNewsRepository;
import com.tickerbot.news.match.ArticleText;
import com.tickerbot.news.match.CandidateGenerator;
import com.tickerbot.news.match.FuzzyGenerator;
import com.tickerbot.news.match.GeneratorFailure;
import com.tickerbot.news.match.NerGenerator;
import com.tickerbot.news.match.SubstringGenerator;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.DetectionMethod;
import com.tickerbot.news.model.ProcessingRun;
import com.tickerbot.news.model.RawArticle;
import com.tickerbot.news.model.RunStatus;
import com.tickerbot.news.model.Ticker;
import com.tickerbot.news.model.TickerDictionary;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineOrchestratorTest {
    private static final OffsetDateTime PUBLISHED = OffsetDateTime.parse("2024-05-01T09:30:00+03:00");

    private final PipelineSettings settings = PipelineSettings.defaults();

    @Test
    void run_shouldStoreArticleAndConfirmedMention() {
        InMemoryNewsRepository repository = repository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);

        ProcessingRun run = orchestrator.run(List.of(article("Акции GAZP выросли", "https://example.ru/1", "rbc")));

        assertEquals(RunStatus.SUCCESS, run.getStatus());
        assertEquals(1, run.getNewArticles());
        assertEquals(0, run.getDuplicates());
        assertEquals(1, run.getMentions());
        assertNotNull(run.getId());

        InMemoryNewsRepository.Mention mention = repository.mentions.values().iterator().next();
        assertEquals(1L, mention.tickerId());
        assertEquals(1.0, mention.fusedScore(), 1e-9);
        assertEquals(DetectionMethod.SUBSTRING, mention.method());
        assertEquals("GAZP", mention.mentionText());
        assertTrue(mention.confirmed());
        assertEquals(1, repository.runs.size());
    }

    @Test
    void run_shouldBeIdempotentOnRerun() {
        InMemoryNewsRepository repository = repository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);
        List<RawArticle> batch = List.of(
                article("Акции GAZP выросли", "https://example.ru/1", "rbc"),
                article("Sberbank raised its dividend", "https://example.com/2", "reuters")
        );

        orchestrator.run(batch);
        int articles = repository.articles.size();
        int mentions = repository.mentions.size();
        ProcessingRun rerun = orchestrator.run(batch);

        assertEquals(RunStatus.SUCCESS, rerun.getStatus());
        assertEquals(0, rerun.getNewArticles());
        assertEquals(2, rerun.getDuplicates());
        assertEquals(0, rerun.getMentions());
        assertEquals(articles, repository.articles.size());
        assertEquals(mentions, repository.mentions.size());
        assertEquals(2, repository.runs.size());
    }

    @Test
    void run_shouldCountDuplicateWithinOneBatch() {
        InMemoryNewsRepository repository = repository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);

        ProcessingRun run = orchestrator.run(List.of(
                article("Акции GAZP выросли", "https://example.ru/1", "rbc"),
                article(" Акции GAZP выросли ", "https://example.ru/1", "interfax")
        ));

        assertEquals(1, run.getNewArticles());
        assertEquals(1, run.getDuplicates());
        assertEquals(1, repository.articles.size());
    }

    @Test
    void run_shouldKeepGoingWhenOneArticleFails() {
        InMemoryNewsRepository repository = repository();
        List<CandidateGenerator> generators = List.of(new SubstringGenerator(), new PoisonedGenerator());
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, generators, settings);

        ProcessingRun run = orchestrator.run(List.of(
                article("Акции GAZP выросли", "https://example.ru/1", "rbc"),
                article("POISON pill for SBER", "https://example.ru/2", "rbc"),
                article("Sberbank raised its dividend", "https://example.com/3", "reuters")
        ));

        assertEquals(RunStatus.PARTIAL, run.getStatus());
        assertEquals(3, run.getNewArticles());
        assertEquals(1, run.getFailedArticles());
        assertEquals(2, run.getMentions());
        assertEquals(3, repository.articles.size());
        assertTrue(run.getLog().contains("failed=1"));
    }

    @Test
    void run_shouldTreatGeneratorFailureAsEmptySignal() {
        InMemoryNewsRepository repository = repository();
        CandidateGenerator broken = new CandidateGenerator() {
            @Override
            public DetectionMethod method() {
                return DetectionMethod.SEMANTIC;
            }

            @Override
            public Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings) {
                throw new GeneratorFailure(DetectionMethod.SEMANTIC, "embedding service down");
            }
        };
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                repository, List.of(new SubstringGenerator(), broken), settings);

        ProcessingRun run = orchestrator.run(List.of(article("Акции GAZP выросли", "https://example.ru/1", "rbc")));

        assertEquals(RunStatus.SUCCESS, run.getStatus());
        assertEquals(0, run.getFailedArticles());
        assertEquals(1, run.getMentions());
        assertTrue(run.getLog().contains("degraded_generators=1"));
    }

    @Test
    void run_shouldRecordFailedRunWhenRepositoryBreaks() {
        InMemoryNewsRepository repository = repository();
        repository.failMentionInsert = true;
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);

        ProcessingRun run = orchestrator.run(List.of(
                article("Акции GAZP выросли", "https://example.ru/1", "rbc"),
                article("Sberbank raised its dividend", "https://example.com/2", "reuters")
        ));

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(1, repository.runs.size());
        assertEquals(RunStatus.FAILED, repository.runs.get(0).getStatus());
        assertFalse(repository.articles.isEmpty());
        assertTrue(repository.mentions.isEmpty());
        assertTrue(run.getLog().contains("connection reset"));
    }

    @Test
    void run_shouldReturnFailedRunWhenRepositoryUnreachable() {
        InMemoryNewsRepository repository = repository();
        repository.failOpen = true;
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);

        ProcessingRun run = orchestrator.run(List.of(article("Акции GAZP выросли", "https://example.ru/1", "rbc")));

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(0, run.getNewArticles());
        assertTrue(repository.runs.isEmpty());
    }

    @Test
    void cancel_shouldStopRunAndKeepStoredRows() {
        InMemoryNewsRepository repository = repository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);
        repository.afterArticleInsert = orchestrator::cancel;

        ProcessingRun run = orchestrator.run(List.of(
                article("Акции GAZP выросли", "https://example.ru/1", "rbc"),
                article("Sberbank raised its dividend", "https://example.com/2", "reuters"),
                article("Weather update", "https://example.com/3", "reuters")
        ));

        assertEquals(RunStatus.PARTIAL, run.getStatus());
        assertEquals(1, repository.articles.size());
        assertEquals(1, run.getNewArticles());
        assertTrue(run.getLog().contains("note=cancelled"));
        assertEquals(1, repository.runs.size());
    }

    @Test
    void cancel_requestedBeforeRunShouldApplyToThatRunOnly() {
        InMemoryNewsRepository repository = repository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);
        List<RawArticle> batch = List.of(article("Акции GAZP выросли", "https://example.ru/1", "rbc"));

        orchestrator.cancel();
        ProcessingRun cancelled = orchestrator.run(batch);
        ProcessingRun next = orchestrator.run(batch);

        assertEquals(RunStatus.PARTIAL, cancelled.getStatus());
        assertEquals(0, cancelled.getNewArticles());
        assertTrue(cancelled.getLog().contains("note=cancelled"));
        assertEquals(RunStatus.SUCCESS, next.getStatus());
        assertEquals(1, next.getNewArticles());
        assertEquals(1, next.getMentions());
        assertEquals(2, repository.runs.size());
    }

    @Test
    void run_shouldRecordFailedRunOnUnexpectedError() {
        InMemoryNewsRepository repository = repository();
        repository.afterArticleInsert = () -> {
            throw new IllegalStateException("driver bug");
        };
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);

        ProcessingRun run = orchestrator.run(List.of(article("Акции GAZP выросли", "https://example.ru/1", "rbc")));

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertNotNull(run.getId());
        assertEquals(1, repository.runs.size());
        assertEquals(RunStatus.FAILED, repository.runs.get(0).getStatus());
        assertTrue(run.getLog().contains("driver bug"));
    }

    @Test
    void run_shouldConfirmSymbolsWhenGeneratorPoolIsSaturated() {
        PipelineSettings saturated = settings.toBuilder()
                .generatorConcurrency(1)
                .articleConcurrency(2)
                .generatorTimeoutMs(500L)
                .build();
        InMemoryNewsRepository repository = repository();
        List<CandidateGenerator> generators = List.of(new SlowGenerator(400L), new SubstringGenerator());
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, generators, saturated);

        ProcessingRun run = orchestrator.run(List.of(
                article("GAZP A", "https://example.ru/a", "rbc"),
                article("GAZP B", "https://example.ru/b", "rbc")
        ));

        assertEquals(RunStatus.SUCCESS, run.getStatus());
        assertEquals(2, run.getMentions());
        assertTrue(run.getLog().contains("degraded_generators=0"), run.getLog());
    }

    @Test
    void run_shouldResolveSourcesByNameOnce() {
        InMemoryNewsRepository repository = repository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);

        orchestrator.run(List.of(
                article("First", "https://example.ru/1", "rbc"),
                article("Second", "https://example.ru/2", "rbc"),
                article("Third", "https://example.ru/3", ""),
                RawArticle.of("Fourth", "https://example.ru/4", PUBLISHED, "", 42L)
        ));

        assertEquals(Set.of("rbc", PipelineOrchestrator.UNKNOWN_SOURCE), repository.sources.keySet());
        long rbc = repository.sources.get("rbc");
        assertEquals(2, repository.articles.values().stream().filter(a -> a.sourceId == rbc).count());
        assertEquals(1, repository.articles.values().stream().filter(a -> a.sourceId == 42L).count());
    }

    @Test
    void run_shouldSucceedWithEmptyBatchOrDictionary() {
        InMemoryNewsRepository repository = new InMemoryNewsRepository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);

        ProcessingRun empty = orchestrator.run(List.of());
        ProcessingRun noTickers = orchestrator.run(List.of(article("Акции GAZP выросли", "https://example.ru/1", "rbc")));

        assertEquals(RunStatus.SUCCESS, empty.getStatus());
        assertEquals(RunStatus.SUCCESS, noTickers.getStatus());
        assertEquals(1, noTickers.getNewArticles());
        assertEquals(0, noTickers.getMentions());
    }

    @Test
    void run_shouldUseGivenDictionarySnapshot() {
        InMemoryNewsRepository repository = new InMemoryNewsRepository();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repository, defaultGenerators(), settings);
        TickerDictionary snapshot = TickerDictionary.of(List.of(new Ticker(7L, "LKOH", "Лукойл", List.of())));

        ProcessingRun run = orchestrator.run(List.of(article("ЛУКОЙЛ отчитался", "https://example.ru/1", "rbc")), snapshot);

        assertEquals(1, run.getMentions());
        assertEquals(7L, repository.mentions.values().iterator().next().tickerId());
    }

    @Test
    void constructor_shouldRejectInvalidSettings() {
        PipelineSettings invalid = settings.toBuilder().confirmThreshold(1.5).build();

        assertThrows(ConfigurationException.class,
                () -> new PipelineOrchestrator(new InMemoryNewsRepository(), defaultGenerators(), invalid));
    }

    private static InMemoryNewsRepository repository() {
        return new InMemoryNewsRepository().withTickers(
                new Ticker(1L, "GAZP", "Газпром", List.of("Gazprom")),
                new Ticker(2L, "SBER", "Сбербанк", List.of("Sberbank"))
        );
    }

    private static List<CandidateGenerator> defaultGenerators() {
        return List.of(new SubstringGenerator(), new FuzzyGenerator(), new NerGenerator());
    }

    private static RawArticle article(String title, String url, String source) {
        return new RawArticle(title, url, PUBLISHED, "", null, source);
    }

    private static final class SlowGenerator implements CandidateGenerator {
        private final long sleepMs;

        private SlowGenerator(long sleepMs) {
            this.sleepMs = sleepMs;
        }

        @Override
        public DetectionMethod method() {
            return DetectionMethod.SEMANTIC;
        }

        @Override
        public Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings) {
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Map.of();
        }
    }

    // Hands back a result that breaks when read, so the failure surfaces outside the generator task.
    private static final class PoisonedGenerator implements CandidateGenerator {
        @Override
        public DetectionMethod method() {
            return DetectionMethod.FUZZY;
        }

        @Override
        public Map<Long, CandidateSignal> generate(ArticleText text, TickerDictionary dictionary, PipelineSettings settings) {
            if (!text.text().contains("POISON")) {
                return Map.of();
            }
            return new AbstractMap<>() {
                @Override
                public Set<Entry<Long, CandidateSignal>> entrySet() {
                    throw new IllegalStateException("corrupt signal map");
                }
            };
        }
    }
}
