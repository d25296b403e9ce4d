package com.tickerbot.news.db;

/**
 * Entry point of the storage boundary. Each run works inside one explicitly scoped
 * {@link RepositorySession}.
 */
public interface NewsRepository {

    RepositorySession openSession() throws PersistenceFailure;
}
