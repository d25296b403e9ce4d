package com.tickerbot.news.model;

/**
 * Outcome of an insert-if-absent call: the stored id and whether this call created it.
 */
public record InsertResult(long articleId, boolean wasNew) {
}
