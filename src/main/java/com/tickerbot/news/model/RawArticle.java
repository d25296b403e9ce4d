package com.tickerbot.news.model;

import java.time.OffsetDateTime;

/**
 * One fetched news record as handed over by the fetcher. Either {@code sourceId}
 * or {@code sourceName} identifies the feed origin.
 */
public final class RawArticle {
    public final String title;
    public final String url;
    public final OffsetDateTime publishedAt;
    public final String body;
    public final Long sourceId;
    public final String sourceName;

    public RawArticle(String title, String url, OffsetDateTime publishedAt, String body, Long sourceId, String sourceName) {
        this.title = title == null ? "" : title.trim();
        this.url = url == null ? "" : url.trim();
        this.publishedAt = publishedAt;
        this.body = body == null ? "" : body;
        this.sourceId = sourceId;
        this.sourceName = sourceName == null ? "" : sourceName.trim();
    }

    public static RawArticle of(String title, String url, OffsetDateTime publishedAt, String body, long sourceId) {
        return new RawArticle(title, url, publishedAt, body, sourceId, null);
    }

    /**
     * Text scanned by the candidate generators.
     */
    public String matchText() {
        if (body.isBlank()) {
            return title;
        }
        if (title.isEmpty()) {
            return body;
        }
        return title + "\n" + body;
    }
}
