package com.daoindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Pending refresh of one entity. Several rows for the same (entityType, index) may coexist until a sync
 * reaching their {@code minLastSync} removes them.
 */
@Document(collection = "sync_queue")
@CompoundIndex(name = "entity_key", def = "{'entityType': 1, 'index': 1}")
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SyncQueueItem {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private EntityType entityType;
    private long index;
    /** Not eligible to run before this moment. */
    @Indexed
    private Instant syncAt;
    /** Freshness the refresh must reach for the item to be done. */
    private Instant minLastSync;
    private int retryCount;

    public SyncQueueItem(EntityType entityType, long index, Instant syncAt, Instant minLastSync) {
        this.entityType = entityType;
        this.index = index;
        this.syncAt = syncAt;
        this.minLastSync = minLastSync;
    }
}
