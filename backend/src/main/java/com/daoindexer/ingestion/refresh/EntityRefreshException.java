package com.daoindexer.ingestion.refresh;

import com.daoindexer.domain.EntityType;
import lombok.Getter;

/**
 * Refresh of one entity failed; the stored entity was not modified.
 */
@Getter
public class EntityRefreshException extends RuntimeException {

    private final EntityType entityType;
    private final long index;

    public EntityRefreshException(EntityType entityType, long index, String message) {
        super(entityType + " #" + index + ": " + message);
        this.entityType = entityType;
        this.index = index;
    }

    public EntityRefreshException(EntityType entityType, long index, String message, Throwable cause) {
        super(entityType + " #" + index + ": " + message, cause);
        this.entityType = entityType;
        this.index = index;
    }
}
