package com.tickerbot.news.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobLogInsertParam {
    private Long id;
    private String jobType;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private int newArticles;
    private int duplicates;
    private int failedArticles;
    private int mentions;
    private String status;
    private String log;
}
