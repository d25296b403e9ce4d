package com.tickerbot.news.model;

import java.time.OffsetDateTime;

/**
 * An article row as persisted, fingerprint included.
 */
public final class StoredArticle {
    public final String hash;
    public final String title;
    public final String url;
    public final String body;
    public final OffsetDateTime publishedAt;
    public final long sourceId;

    public StoredArticle(String hash, String title, String url, String body, OffsetDateTime publishedAt, long sourceId) {
        this.hash = hash;
        this.title = title == null ? "" : title;
        this.url = url == null ? "" : url;
        this.body = body == null ? "" : body;
        this.publishedAt = publishedAt;
        this.sourceId = sourceId;
    }
}
