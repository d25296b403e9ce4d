package com.tickerbot.news.input;

import com.tickerbot.news.model.RawArticle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a fetched batch: a JSON array of
 * {@code {title, url, published_at, body|summary, source_id|source}} objects.
 * Records without a title or URL are skipped with a warning.
 */
public final class RawArticleReader {
    private static final Logger log = LogManager.getLogger(RawArticleReader.class);

    public List<RawArticle> read(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return parse(json);
        } catch (JSONException e) {
            throw new IOException("malformed article batch " + file + ": " + e.getMessage(), e);
        }
    }

    public List<RawArticle> parse(String json) {
        JSONArray array = new JSONArray(json);
        List<RawArticle> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                log.warn("batch entry {} is not an object, skipped", i);
                continue;
            }
            String title = item.optString("title", "").trim();
            String url = item.optString("url", "").trim();
            if (title.isEmpty() || url.isEmpty()) {
                log.warn("batch entry {} lacks title or url, skipped", i);
                continue;
            }
            String body = item.has("body") ? item.optString("body", "") : item.optString("summary", "");
            Long sourceId = item.has("source_id") && !item.isNull("source_id") ? item.getLong("source_id") : null;
            String sourceName = item.optString("source", "");
            out.add(new RawArticle(title, url, parseTimestamp(item.optString("published_at", ""), i), body, sourceId, sourceName));
        }
        return out;
    }

    private OffsetDateTime parseTimestamp(String raw, int index) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim());
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(raw.trim()).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                log.warn("batch entry {} has unparseable published_at '{}', stored without date", index, raw);
                return null;
            }
        }
    }
}
