package com.tickerbot.news.match;

import java.util.List;

/**
 * Extracts organization or company name spans from article text.
 */
public interface EntityExtractor {

    /**
     * @return distinct organization spans in order of first appearance, possibly empty
     * @throws GeneratorFailure when the backend is unavailable
     */
    List<String> extractOrganizations(ArticleText text);
}
