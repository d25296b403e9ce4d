package com.tickerbot.news.summary;

import com.tickerbot.news.db.NewsRepository;
import com.tickerbot.news.db.PersistenceFailure;
import com.tickerbot.news.db.RepositorySession;
import com.tickerbot.news.model.MentionRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the daily mention report from confirmed mentions. Read-only: repeated calls
 * for the same date return equal reports while nothing new is written.
 */
public final class SummaryAggregator {
    private static final Logger log = LogManager.getLogger(SummaryAggregator.class);
    static final int MAX_HEADLINES = 3;

    private static final Comparator<MentionRow> BY_PUBLICATION = Comparator
            .comparing((MentionRow row) -> row.publishedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingLong(row -> row.articleId);

    private final NewsRepository repository;
    private final ZoneId zone;
    private final int topN;

    /**
     * @param topN maximum number of ranked tickers; 0 keeps all
     */
    public SummaryAggregator(NewsRepository repository, ZoneId zone, int topN) {
        this.repository = repository;
        this.zone = zone;
        this.topN = Math.max(0, topN);
    }

    public DailySummary generateSummary(LocalDate date) throws PersistenceFailure {
        List<MentionRow> rows;
        try (RepositorySession session = repository.openSession()) {
            rows = session.mentionsForDate(date, zone);
        }
        DailySummary summary = aggregate(date, rows);
        log.info("daily summary built: date={} zone={} mentions={} tickers={}",
                date, zone, rows.size(), summary.getClusters().size());
        return summary;
    }

    DailySummary aggregate(LocalDate date, List<MentionRow> rows) {
        Map<Long, List<MentionRow>> byTicker = new TreeMap<>();
        for (MentionRow row : rows) {
            if (!publishedOn(row.publishedAt, date)) {
                continue;
            }
            byTicker.computeIfAbsent(row.tickerId, ignored -> new ArrayList<>()).add(row);
        }

        List<DailySummary.TopMention> top = new ArrayList<>();
        List<DailySummary.Cluster> clusters = new ArrayList<>();
        for (Map.Entry<Long, List<MentionRow>> entry : byTicker.entrySet()) {
            List<MentionRow> mentions = new ArrayList<>(entry.getValue());
            mentions.sort(BY_PUBLICATION);

            Set<Long> articles = new HashSet<>();
            Set<Long> sources = new HashSet<>();
            Set<String> headlines = new LinkedHashSet<>();
            Set<String> links = new LinkedHashSet<>();
            String symbol = "";
            for (MentionRow row : mentions) {
                articles.add(row.articleId);
                sources.add(row.sourceId);
                if (symbol.isEmpty()) {
                    symbol = row.symbol;
                }
                if (headlines.size() < MAX_HEADLINES && !row.title.isBlank()) {
                    headlines.add(row.title);
                }
                if (links.size() < MAX_HEADLINES && !row.url.isBlank()) {
                    links.add(row.url);
                }
            }
            long ticker = entry.getKey();
            top.add(new DailySummary.TopMention(ticker, symbol, articles.size()));
            clusters.add(new DailySummary.Cluster(ticker, symbol, sources.size(), articles.size(),
                    new ArrayList<>(headlines), new ArrayList<>(links)));
        }

        top.sort(Comparator.comparingInt(DailySummary.TopMention::count).reversed()
                .thenComparingLong(DailySummary.TopMention::ticker));
        if (topN > 0 && top.size() > topN) {
            top = new ArrayList<>(top.subList(0, topN));
        }
        clusters.sort(Comparator.comparingInt(DailySummary.Cluster::sourcesCount).reversed()
                .thenComparingLong(DailySummary.Cluster::ticker));
        return new DailySummary(date, top, clusters);
    }

    private boolean publishedOn(OffsetDateTime publishedAt, LocalDate date) {
        return publishedAt != null && publishedAt.atZoneSameInstant(zone).toLocalDate().equals(date);
    }
}
