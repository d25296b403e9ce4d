package com.tickerbot.news.model;

/**
 * Per-article progress through one run. DUPLICATE, PERSISTED and FAILED are terminal.
 */
public enum ArticleState {
    FETCHED,
    HASHED,
    DUPLICATE,
    NEW,
    GENERATING,
    FUSING,
    CONFIRMING,
    PERSISTED,
    FAILED
}
