package com.tickerbot.news.db;

/**
 * The repository could not be reached or rejected a write for a reason other than
 * the expected duplicate-hash no-op. Fatal to the current run.
 */
public class PersistenceFailure extends Exception {
    public PersistenceFailure(String message) {
        super(message);
    }

    public PersistenceFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
