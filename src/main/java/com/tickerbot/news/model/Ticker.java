package com.tickerbot.news.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reference ticker entry. Read-only to the pipeline.
 */
public final class Ticker {
    public final long id;
    public final String symbol;
    public final String name;
    public final List<String> aliases;
    public final String description;

    public Ticker(long id, String symbol, String name, List<String> aliases, String description) {
        this.id = id;
        this.symbol = symbol == null ? "" : symbol.trim();
        this.name = name == null ? "" : name.trim();
        Set<String> unique = new LinkedHashSet<>();
        if (aliases != null) {
            for (String alias : aliases) {
                if (alias != null && !alias.isBlank()) {
                    unique.add(alias.trim());
                }
            }
        }
        this.aliases = Collections.unmodifiableList(new ArrayList<>(unique));
        this.description = description == null ? "" : description.trim();
    }

    public Ticker(long id, String symbol, String name, List<String> aliases) {
        this(id, symbol, name, aliases, null);
    }

    /**
     * Text embedded by the semantic generator.
     */
    public String descriptiveText() {
        StringBuilder sb = new StringBuilder();
        sb.append(name.isEmpty() ? symbol : name);
        if (!symbol.isEmpty() && !name.isEmpty()) {
            sb.append(" (").append(symbol).append(')');
        }
        if (!aliases.isEmpty()) {
            sb.append(". Also known as: ").append(String.join(", ", aliases));
        }
        if (!description.isEmpty()) {
            sb.append(". ").append(description);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Ticker{" + id + ":" + symbol + "}";
    }
}
