package com.daoindexer.config;

/**
 * Configuration conflicts with the data already indexed; the application must not start.
 */
public class IndexerConfigurationException extends RuntimeException {

    public IndexerConfigurationException(String message) {
        super(message);
    }
}
