package com.tickerbot.news.hash;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content fingerprint used for deduplication.
 * SHA-256 over the trimmed title and URL. The title is length-prefixed so the
 * boundary between the two fields cannot shift, and case is preserved.
 */
public final class ArticleHasher {

    private ArticleHasher() {
    }

    public static String fingerprint(String title, String url) {
        String normalizedTitle = normalize(title);
        String normalizedUrl = normalize(url);
        String material = normalizedTitle.length() + ":" + normalizedTitle + "\n" + normalizedUrl;
        return sha256(material);
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim();
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] out = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(out.length * 2);
            for (byte b : out) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("failed to compute article hash", e);
        }
    }
}
