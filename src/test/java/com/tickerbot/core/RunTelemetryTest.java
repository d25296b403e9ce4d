package com.tickerbot.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("pipeline", "manual", Instant.parse("2024-05-01T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_DEDUP);
        telemetry.endStep(RunTelemetry.STEP_DEDUP, 10, 7, 0);
        telemetry.startStep(RunTelemetry.STEP_MATCH);
        telemetry.endStep(RunTelemetry.STEP_MATCH, 7, 5, 1);
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("job_type=pipeline"));
        assertTrue(summary.contains("trigger=manual"));
        assertTrue(summary.contains("started_at=2024-05-01T00:00:00Z"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains(RunTelemetry.STEP_MATCH));
    }

    @Test
    void countersLineShouldReflectCounts() {
        RunTelemetry telemetry = new RunTelemetry(null, " ", null);
        telemetry.countArticle();
        telemetry.countArticle();
        telemetry.countNew();
        telemetry.countDuplicate();
        telemetry.countMentions(3);
        telemetry.countMentions(-2);
        telemetry.countDegradedGenerators(1);

        assertEquals("articles=2 new=1 duplicates=1 failed=0 mentions=3 degraded_generators=1", telemetry.countersLine());
        assertEquals("pipeline", telemetry.jobType());
        assertTrue(telemetry.stepRecords().isEmpty());
    }
}
