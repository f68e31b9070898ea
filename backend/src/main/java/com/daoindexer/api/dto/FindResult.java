package com.daoindexer.api.dto;

/**
 * Lookup result that is not an error when nothing matched.
 */
public record FindResult<T>(boolean found, T data) {

    public static <T> FindResult<T> of(T data) {
        return new FindResult<>(data != null, data);
    }
}
