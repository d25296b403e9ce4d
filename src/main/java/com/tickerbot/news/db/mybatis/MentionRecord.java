package com.tickerbot.news.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MentionRecord {
    private long articleId;
    private long tickerId;
    private String symbol;
    private long sourceId;
    private String title;
    private String url;
    private OffsetDateTime publishedAt;
    private double fusedScore;
}
