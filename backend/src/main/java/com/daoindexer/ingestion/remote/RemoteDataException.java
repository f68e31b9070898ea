package com.daoindexer.ingestion.remote;

/**
 * Thrown when a call to the remote data API fails (HTTP, JSON-RPC error, timeout or local rate limit).
 */
public class RemoteDataException extends RuntimeException {

    public RemoteDataException(String message) {
        super(message);
    }

    public RemoteDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
