package com.tickerbot.app;

import com.tickerbot.news.config.Config;
import com.tickerbot.news.config.ConfigurationException;
import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.db.Database;
import com.tickerbot.news.db.MigrationRunner;
import com.tickerbot.news.db.NewsRepository;
import com.tickerbot.news.db.PersistenceFailure;
import com.tickerbot.news.db.PostgresNewsRepository;
import com.tickerbot.news.db.RepositorySession;
import com.tickerbot.news.input.RawArticleReader;
import com.tickerbot.news.match.LangChainModels;
import com.tickerbot.news.model.ProcessingRun;
import com.tickerbot.news.model.RawArticle;
import com.tickerbot.news.model.RunStatus;
import com.tickerbot.news.runner.PipelineOrchestrator;
import com.tickerbot.news.summary.DailySummary;
import com.tickerbot.news.summary.SummaryAggregator;
import com.tickerbot.news.summary.SummaryWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 * <pre>
 *   tickerbot --run --input batch.json
 *   tickerbot --summary [--date 2024-05-01] [--out dir]
 * </pre>
 */
public final class TickerBotApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_LOCKED = 3;

    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private static final Logger log = LogManager.getLogger(TickerBotApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new TickerBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("tickerbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help") || (!cmd.hasOption("run") && !cmd.hasOption("summary"))) {
            new HelpFormatter().printHelp("tickerbot", options);
            return cmd.hasOption("help") ? EXIT_OK : EXIT_USAGE;
        }
        if (cmd.hasOption("run") && !cmd.hasOption("input")) {
            System.err.println("ERROR: --input is required with --run.");
            return EXIT_USAGE;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        installLogRoutingIfNeeded(config);

        PipelineSettings settings;
        try {
            settings = PipelineSettings.fromConfig(config);
        } catch (ConfigurationException e) {
            log.error("invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        try {
            Database database = new Database(
                    TickerBotBootstrapConfig.firstNonBlank(System.getenv("TICKERBOT_DB_URL"), config.getString("db.url")),
                    TickerBotBootstrapConfig.firstNonBlank(System.getenv("TICKERBOT_DB_USER"), config.getString("db.user")),
                    TickerBotBootstrapConfig.firstNonBlank(System.getenv("TICKERBOT_DB_PASS"), config.getString("db.pass")),
                    config.getString("db.schema")
            );
            log.info("DB url={}, schema={}", database.maskedJdbcUrl(), database.schema());
            new MigrationRunner().run(database);
            NewsRepository repository = new PostgresNewsRepository(database);

            if (cmd.hasOption("run")) {
                return runPipeline(cmd, config, settings, repository, workingDir);
            }
            return writeSummary(cmd, config, settings, repository, workingDir);
        } catch (Exception e) {
            log.fatal("tickerbot failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    private int runPipeline(
            CommandLine cmd,
            Config config,
            PipelineSettings settings,
            NewsRepository repository,
            Path workingDir
    ) throws IOException, PersistenceFailure {
        Path input = workingDir.resolve(cmd.getOptionValue("input")).normalize();
        List<RawArticle> batch = new RawArticleReader().read(input);
        log.info("loaded {} article(s) from {}", batch.size(), input);

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                repository,
                LangChainModels.generators(config, settings),
                settings
        );
        CancelOnShutdown cancelOnShutdown = new CancelOnShutdown(orchestrator::cancel, SHUTDOWN_GRACE);
        Thread cancelHook = new Thread(cancelOnShutdown, "tickerbot-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);

        String owner = lockOwner();
        boolean locked = false;
        try {
            if (settings.isLockEnabled()) {
                try (RepositorySession session = repository.openSession()) {
                    locked = session.tryAcquireRunLock(owner, settings.lockStaleAfter());
                }
                if (!locked) {
                    log.warn("another pipeline run holds the lock; exiting without processing");
                    return EXIT_LOCKED;
                }
            }
            ProcessingRun run = orchestrator.run(batch);
            System.out.println("run status=" + run.getStatus().wireName()
                    + " new=" + run.getNewArticles()
                    + " duplicates=" + run.getDuplicates()
                    + " failed=" + run.getFailedArticles()
                    + " mentions=" + run.getMentions());
            return run.getStatus() == RunStatus.FAILED ? EXIT_FATAL : EXIT_OK;
        } finally {
            if (locked) {
                releaseLock(repository, owner);
            }
            cancelOnShutdown.finished();
            removeHook(cancelHook);
        }
    }

    private int writeSummary(
            CommandLine cmd,
            Config config,
            PipelineSettings settings,
            NewsRepository repository,
            Path workingDir
    ) throws IOException, PersistenceFailure {
        LocalDate date;
        try {
            date = cmd.hasOption("date")
                    ? LocalDate.parse(cmd.getOptionValue("date").trim())
                    : LocalDate.now(settings.getSummaryZone()).minusDays(1);
        } catch (DateTimeParseException e) {
            System.err.println("ERROR: --date must be yyyy-MM-dd: " + e.getParsedString());
            return EXIT_USAGE;
        }
        Path outDir = cmd.hasOption("out")
                ? workingDir.resolve(cmd.getOptionValue("out")).normalize()
                : config.getPath("summary.output-dir");

        SummaryAggregator aggregator = new SummaryAggregator(repository, settings.getSummaryZone(), settings.getSummaryTopN());
        DailySummary summary = aggregator.generateSummary(date);
        Path written = new SummaryWriter(outDir).write(summary);
        System.out.println("summary written: " + written);
        return EXIT_OK;
    }

    private void releaseLock(NewsRepository repository, String owner) {
        try (RepositorySession session = repository.openSession()) {
            session.releaseRunLock(owner);
        } catch (PersistenceFailure e) {
            log.warn("failed to release run lock (it will expire as stale): {}", e.getMessage());
        }
    }

    private void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("shutdown already in progress, hook stays: {}", e.getMessage());
        }
    }

    private String lockOwner() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + ":" + ProcessHandle.current().pid();
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TickerBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("tickerbot.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(TickerBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                log.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                log.warn("failed to initialize log4j routing: {}", e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("run").desc("process a fetched article batch").build());
        options.addOption(Option.builder().longOpt("input").hasArg().argName("path").desc("JSON array of fetched articles (with --run)").build());
        options.addOption(Option.builder().longOpt("summary").desc("write the daily mention summary").build());
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyy-MM-dd").desc("summary date, default yesterday in summary.zone").build());
        options.addOption(Option.builder().longOpt("out").hasArg().argName("dir").desc("summary output directory, default summary.output-dir").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    /**
     * Shutdown hook body: requests cancellation, then holds the JVM until the run has
     * recorded itself and released the lock, or the grace period runs out.
     */
    static final class CancelOnShutdown implements Runnable {
        private final Runnable cancel;
        private final Duration grace;
        private final CountDownLatch done = new CountDownLatch(1);

        CancelOnShutdown(Runnable cancel, Duration grace) {
            this.cancel = cancel;
            this.grace = grace;
        }

        @Override
        public void run() {
            if (done.getCount() == 0) {
                return;
            }
            log.warn("shutdown requested, cancelling pipeline run");
            cancel.run();
            try {
                if (!done.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("pipeline run did not finish within {}s of shutdown", grace.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        void finished() {
            done.countDown();
        }
    }
}
