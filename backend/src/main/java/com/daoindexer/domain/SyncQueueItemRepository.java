package com.daoindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for sync_queue. Drained by SyncQueueJob, filled by SyncQueueService.
 */
public interface SyncQueueItemRepository extends MongoRepository<SyncQueueItem, String> {

    /** Earliest-due item. */
    Optional<SyncQueueItem> findFirstByOrderBySyncAtAsc();

    boolean existsByEntityTypeAndIndex(EntityType entityType, long index);

    /** Removes every row of the key, whatever its threshold. */
    long deleteByEntityTypeAndIndex(EntityType entityType, long index);

    /** Removes the rows of the key satisfied by the achieved freshness. */
    long deleteByEntityTypeAndIndexAndMinLastSyncLessThanEqual(EntityType entityType, long index, Instant lastSync);
}
