package com.tickerbot.news.config;

/**
 * Invalid pipeline configuration. Raised before any article is processed.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
