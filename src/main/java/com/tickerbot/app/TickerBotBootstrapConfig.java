package com.tickerbot.app;

import com.tickerbot.app.properties.DbProperties;
import com.tickerbot.news.config.Config;
import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.db.Database;
import com.tickerbot.news.db.MigrationRunner;
import com.tickerbot.news.db.NewsRepository;
import com.tickerbot.news.db.PostgresNewsRepository;
import com.tickerbot.news.match.LangChainModels;
import com.tickerbot.news.runner.PipelineOrchestrator;
import com.tickerbot.news.summary.SummaryAggregator;
import com.tickerbot.news.summary.SummaryWriter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring wiring for embedding the pipeline in a host application. Database-backed
 * beans are lazy so the context starts without a reachable PostgreSQL.
 */
@Configuration
@EnableConfigurationProperties(DbProperties.class)
public class TickerBotBootstrapConfig {
    private static final List<String> CONFIG_PREFIXES = List.of("pipeline", "summary", "ai", "db", "outputs");

    @Bean
    public Config tickerBotConfig(Environment environment) {
        Binder binder = Binder.get(environment);
        Map<String, Object> bound = new LinkedHashMap<>();
        for (String prefix : CONFIG_PREFIXES) {
            Map<String, Object> section = binder
                    .bind(prefix, Bindable.mapOf(String.class, Object.class))
                    .orElseGet(Map::of);
            if (!section.isEmpty()) {
                bound.put(prefix, section);
            }
        }
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, bound);
    }

    @Bean
    public PipelineSettings pipelineSettings(Config tickerBotConfig) {
        return PipelineSettings.fromConfig(tickerBotConfig);
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                firstNonBlank(System.getenv("TICKERBOT_DB_URL"), dbProperties.getUrl()),
                firstNonBlank(System.getenv("TICKERBOT_DB_USER"), dbProperties.getUser()),
                firstNonBlank(System.getenv("TICKERBOT_DB_PASS"), dbProperties.getPass()),
                dbProperties.getSchema()
        );
        if (dbProperties.isMigrate()) {
            try {
                new MigrationRunner().run(database);
            } catch (Exception e) {
                throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
            }
        }
        return database;
    }

    @Bean
    @Lazy
    public NewsRepository newsRepository(Database database) {
        return new PostgresNewsRepository(database);
    }

    @Bean
    @Lazy
    public PipelineOrchestrator pipelineOrchestrator(
            NewsRepository newsRepository,
            Config tickerBotConfig,
            PipelineSettings pipelineSettings
    ) {
        return new PipelineOrchestrator(
                newsRepository,
                LangChainModels.generators(tickerBotConfig, pipelineSettings),
                pipelineSettings
        );
    }

    @Bean
    @Lazy
    public SummaryAggregator summaryAggregator(NewsRepository newsRepository, PipelineSettings pipelineSettings) {
        return new SummaryAggregator(newsRepository, pipelineSettings.getSummaryZone(), pipelineSettings.getSummaryTopN());
    }

    @Bean
    public SummaryWriter summaryWriter(Config tickerBotConfig) {
        return new SummaryWriter(tickerBotConfig.getPath("summary.output-dir"));
    }

    static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }
}
