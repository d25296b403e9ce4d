package com.tickerbot.news.summary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Writes a {@link DailySummary} as {@code yesterday_summary_<date>.json}.
 */
public final class SummaryWriter {
    private final Path outputDir;
    private final Clock clock;

    public SummaryWriter(Path outputDir) {
        this(outputDir, Clock.systemUTC());
    }

    SummaryWriter(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    public Path write(DailySummary summary) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve("yesterday_summary_" + summary.getDate() + ".json");
        String json = summary.toJson()
                .put("generated_at", Instant.now(clock).toString())
                .toString(2);
        Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
        return target;
    }
}
