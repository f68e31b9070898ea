package com.daoindexer.domain;

/**
 * Kind of tracked contract entity; also the dispatch key of the sync queue.
 */
public enum EntityType {
    ADMIN,
    USER,
    ORDER
}
