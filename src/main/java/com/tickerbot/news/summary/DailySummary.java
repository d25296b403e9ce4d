package com.tickerbot.news.summary;

import lombok.Value;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.LocalDate;
import java.util.List;

/**
 * Report for one calendar day: mention ranking and per-ticker source diversity.
 */
@Value
public class DailySummary {
    LocalDate date;
    List<TopMention> topMentions;
    List<Cluster> clusters;

    public DailySummary(LocalDate date, List<TopMention> topMentions, List<Cluster> clusters) {
        this.date = date;
        this.topMentions = List.copyOf(topMentions);
        this.clusters = List.copyOf(clusters);
    }

    public record TopMention(long ticker, String symbol, int count) {
    }

    public record Cluster(
            long ticker,
            String symbol,
            int sourcesCount,
            int mentions,
            List<String> headlines,
            List<String> links
    ) {
        public Cluster {
            headlines = List.copyOf(headlines);
            links = List.copyOf(links);
        }
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("date", date.toString());

        JSONArray top = new JSONArray();
        for (TopMention mention : topMentions) {
            top.put(new JSONObject()
                    .put("ticker", mention.ticker())
                    .put("symbol", mention.symbol())
                    .put("count", mention.count()));
        }
        root.put("top_mentions", top);

        JSONArray groups = new JSONArray();
        for (Cluster cluster : clusters) {
            groups.put(new JSONObject()
                    .put("ticker", cluster.ticker())
                    .put("symbol", cluster.symbol())
                    .put("sources_count", cluster.sourcesCount())
                    .put("mentions", cluster.mentions())
                    .put("headlines", new JSONArray(cluster.headlines()))
                    .put("links", new JSONArray(cluster.links())));
        }
        root.put("clusters", groups);
        return root;
    }
}
