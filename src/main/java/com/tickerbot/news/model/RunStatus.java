package com.tickerbot.news.model;

import java.util.Locale;

public enum RunStatus {
    SUCCESS,
    FAILED,
    PARTIAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
