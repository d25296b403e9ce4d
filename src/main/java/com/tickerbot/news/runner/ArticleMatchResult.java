package com.tickerbot.news.runner;

import com.tickerbot.news.model.ArticleState;
import com.tickerbot.news.model.FusedResult;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * What the matching stages produced for one new article. {@code state} is
 * {@link ArticleState#CONFIRMING} when the confirmed set is ready to persist, or
 * {@link ArticleState#FAILED}.
 */
public final class ArticleMatchResult {
    public final long articleId;
    public final ArticleState state;
    public final Map<Long, FusedResult> fused;
    public final Map<Long, FusedResult> confirmed;
    public final int degradedGenerators;
    public final String error;

    private ArticleMatchResult(
            long articleId,
            ArticleState state,
            Map<Long, FusedResult> fused,
            Map<Long, FusedResult> confirmed,
            int degradedGenerators,
            String error
    ) {
        this.articleId = articleId;
        this.state = state;
        this.fused = Collections.unmodifiableMap(new TreeMap<>(fused));
        this.confirmed = Collections.unmodifiableMap(new TreeMap<>(confirmed));
        this.degradedGenerators = degradedGenerators;
        this.error = error == null ? "" : error;
    }

    static ArticleMatchResult matched(
            long articleId,
            Map<Long, FusedResult> fused,
            Map<Long, FusedResult> confirmed,
            int degradedGenerators
    ) {
        return new ArticleMatchResult(articleId, ArticleState.CONFIRMING, fused, confirmed, degradedGenerators, "");
    }

    static ArticleMatchResult failed(long articleId, ArticleState failedIn, String error) {
        return new ArticleMatchResult(articleId, ArticleState.FAILED, Map.of(), Map.of(), 0,
                failedIn.name().toLowerCase(Locale.ROOT) + ": " + error);
    }

    public boolean isFailed() {
        return state == ArticleState.FAILED;
    }
}
