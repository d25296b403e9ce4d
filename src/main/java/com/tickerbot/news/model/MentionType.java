package com.tickerbot.news.model;

import java.util.Locale;

public enum MentionType {
    SYMBOL,
    NAME,
    ALIAS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MentionType fromWireName(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("mention type is null");
        }
        return MentionType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
