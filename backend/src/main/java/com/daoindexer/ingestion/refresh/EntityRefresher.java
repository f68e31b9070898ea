package com.daoindexer.ingestion.refresh;

import com.daoindexer.domain.EntityType;

import java.time.Instant;

/**
 * Refresh operation for one entity type: one implementation per {@link EntityType}.
 */
public interface EntityRefresher {

    /** Returned when the entity row does not exist: the queued work is abandoned. */
    Instant NOT_FOUND = Instant.MAX;

    EntityType entityType();

    /**
     * Reloads the entity from the remote source and stores it.
     *
     * @return freshness achieved, or {@link #NOT_FOUND}
     * @throws EntityRefreshException or {@link com.daoindexer.ingestion.remote.RemoteDataException} on failure,
     *                                in which case the stored entity is unchanged
     */
    Instant refresh(long index);
}
