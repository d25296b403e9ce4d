package com.tickerbot.news.model;

import java.time.OffsetDateTime;

/**
 * A confirmed mention joined with its article, as read back for daily reporting.
 */
public final class MentionRow {
    public final long articleId;
    public final long tickerId;
    public final String symbol;
    public final long sourceId;
    public final String title;
    public final String url;
    public final OffsetDateTime publishedAt;
    public final double fusedScore;

    public MentionRow(
            long articleId,
            long tickerId,
            String symbol,
            long sourceId,
            String title,
            String url,
            OffsetDateTime publishedAt,
            double fusedScore
    ) {
        this.articleId = articleId;
        this.tickerId = tickerId;
        this.symbol = symbol == null ? "" : symbol;
        this.sourceId = sourceId;
        this.title = title == null ? "" : title;
        this.url = url == null ? "" : url;
        this.publishedAt = publishedAt;
        this.fusedScore = fusedScore;
    }
}
