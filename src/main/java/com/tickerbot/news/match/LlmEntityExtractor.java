package com.tickerbot.news.match;

import com.tickerbot.news.model.DetectionMethod;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.json.JSONArray;
import org.json.JSONException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Organization extraction through a chat model. The model is asked for a JSON array
 * of company names and anything else in its reply is ignored.
 */
public final class LlmEntityExtractor implements EntityExtractor {
    private static final int MAX_INPUT_CHARS = 4000;

    private final ChatLanguageModel chatModel;

    public LlmEntityExtractor(ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public List<String> extractOrganizations(ArticleText text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (chatModel == null) {
            throw new GeneratorFailure(DetectionMethod.NER, "chat model unavailable");
        }
        String reply;
        try {
            reply = chatModel.generate(buildPrompt(text.text()));
        } catch (RuntimeException e) {
            throw new GeneratorFailure(DetectionMethod.NER, "entity extraction call failed: " + e.getMessage(), e);
        }
        return parseNames(reply);
    }

    static String buildPrompt(String text) {
        String body = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        return "Extract every company, bank or other organization named in the news text below.\n"
                + "Answer with a JSON array of strings only, exactly as written in the text, e.g. [\"Газпром\", \"Apple Inc\"].\n"
                + "Answer [] if there are none.\n\n"
                + "TEXT:\n" + body;
    }

    static List<String> parseNames(String reply) {
        if (reply == null) {
            throw new GeneratorFailure(DetectionMethod.NER, "empty entity extraction reply");
        }
        int open = reply.indexOf('[');
        int close = reply.lastIndexOf(']');
        if (open < 0 || close < open) {
            throw new GeneratorFailure(DetectionMethod.NER, "entity extraction reply has no JSON array");
        }
        JSONArray array;
        try {
            array = new JSONArray(reply.substring(open, close + 1));
        } catch (JSONException e) {
            throw new GeneratorFailure(DetectionMethod.NER, "malformed entity extraction reply: " + e.getMessage(), e);
        }
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < array.length(); i++) {
            String name = array.optString(i, "").trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }
}
