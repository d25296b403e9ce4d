package com.tickerbot.news.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Audit record of one orchestrator invocation. Appended once at run end.
 */
@Value
@Builder(toBuilder = true)
public class ProcessingRun {
    Long id;
    @Builder.Default
    String jobType = "pipeline";
    OffsetDateTime startedAt;
    OffsetDateTime finishedAt;
    int newArticles;
    int duplicates;
    int failedArticles;
    int mentions;
    RunStatus status;
    @Builder.Default
    String log = "";
}
