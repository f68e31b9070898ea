package com.daoindexer.ingestion.queue;

import com.daoindexer.domain.EntityType;
import com.daoindexer.domain.SyncQueueItem;
import com.daoindexer.domain.SyncQueueItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;

/**
 * Appends rows to the sync queue. Used by force-resync, by the admin endpoint and by discovery producers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncQueueService {

    private final SyncQueueItemRepository syncQueueItemRepository;

    /** Enqueues a refresh due now that must reach at least the current moment. */
    public SyncQueueItem enqueue(EntityType entityType, long index) {
        Instant now = Instant.now();
        return enqueue(entityType, index, now);
    }

    public SyncQueueItem enqueue(EntityType entityType, long index, Instant minLastSync) {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(minLastSync, "minLastSync");
        if (index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
        SyncQueueItem item = syncQueueItemRepository.save(
                new SyncQueueItem(entityType, index, Instant.now(), minLastSync));
        log.debug("Enqueued {} #{} (minLastSync={})", entityType, index, minLastSync);
        return item;
    }

    public boolean isQueued(EntityType entityType, long index) {
        return syncQueueItemRepository.existsByEntityTypeAndIndex(entityType, index);
    }
}
