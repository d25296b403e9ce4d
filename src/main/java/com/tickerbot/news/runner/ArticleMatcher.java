package com.tickerbot.news.runner;

import com.tickerbot.news.fusion.ConfirmationPolicy;
import com.tickerbot.news.fusion.SignalFuser;
import com.tickerbot.news.match.ArticleText;
import com.tickerbot.news.match.GeneratorFanout;
import com.tickerbot.news.match.GeneratorOutcome;
import com.tickerbot.news.model.ArticleState;
import com.tickerbot.news.model.CandidateSignal;
import com.tickerbot.news.model.FusedResult;
import com.tickerbot.news.model.RawArticle;
import com.tickerbot.news.model.TickerDictionary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * GENERATING, FUSING and CONFIRMING for one new article. Never touches the repository.
 * Failures are returned as a FAILED result so the run can continue with other articles.
 */
public final class ArticleMatcher {
    private static final Logger log = LogManager.getLogger(ArticleMatcher.class);

    private final GeneratorFanout fanout;
    private final SignalFuser fuser;
    private final ConfirmationPolicy policy;

    public ArticleMatcher(GeneratorFanout fanout, SignalFuser fuser, ConfirmationPolicy policy) {
        this.fanout = fanout;
        this.fuser = fuser;
        this.policy = policy;
    }

    /**
     * @throws CancellationException when the run is being cancelled
     */
    public ArticleMatchResult match(long articleId, RawArticle article, TickerDictionary dictionary) {
        String ref = "article#" + articleId;
        ArticleState state = ArticleState.GENERATING;
        try {
            ArticleText text = ArticleText.of(article.matchText());
            List<GeneratorOutcome> outcomes = fanout.run(ref, text, dictionary);
            int degraded = 0;
            List<Map<Long, CandidateSignal>> signals = new ArrayList<>(outcomes.size());
            for (GeneratorOutcome outcome : outcomes) {
                if (outcome.isDegraded()) {
                    degraded++;
                }
                signals.add(outcome.signals());
            }

            state = ArticleState.FUSING;
            Map<Long, FusedResult> fused = fuser.fuse(signals);

            state = ArticleState.CONFIRMING;
            Map<Long, FusedResult> confirmed = policy.confirm(fused);
            log.debug("{} fused={} confirmed={} degraded_generators={}", ref, fused.size(), confirmed.size(), degraded);
            return ArticleMatchResult.matched(articleId, fused, confirmed, degraded);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed during {}: {}", ref, state, e.toString(), e);
            return ArticleMatchResult.failed(articleId, state, e.toString());
        }
    }
}
