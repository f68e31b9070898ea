package com.daoindexer.ingestion.job;

import com.daoindexer.common.RecurringWork;
import com.daoindexer.common.RunTrigger;
import com.daoindexer.common.SyncBackoff;
import com.daoindexer.common.TaskContext;
import com.daoindexer.common.TaskNames;
import com.daoindexer.domain.EntityType;
import com.daoindexer.domain.SyncQueueItem;
import com.daoindexer.domain.SyncQueueItemRepository;
import com.daoindexer.ingestion.config.SyncProperties;
import com.daoindexer.ingestion.refresh.EntityRefresher;
import com.daoindexer.ingestion.remote.RemoteDataClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drains the sync queue earliest-due first, at most {@code batchCap} items per run.
 *
 * <p>Each due item is dispatched to the refresher of its entity type. Rows of the key whose
 * {@code minLastSync <= achieved} are removed; if the achieved freshness is still {@code < minLastSync}
 * of the processed item, or the refresh failed, the item is pushed back by {@link SyncBackoff}. The run
 * also picks the delay before the next one: fast while the remote client is not ready, until the next
 * due item, or the normal interval, whichever is smaller. A run that processed anything asks for a cache
 * rebuild.
 */
@Component
@Slf4j
public class SyncQueueJob implements RecurringWork {

    private final SyncQueueItemRepository syncQueueItemRepository;
    private final RemoteDataClient remoteDataClient;
    private final Map<EntityType, EntityRefresher> refreshers;
    private final RunTrigger cacheRebuildTrigger;
    private final SyncProperties properties;

    public SyncQueueJob(SyncQueueItemRepository syncQueueItemRepository,
                        RemoteDataClient remoteDataClient,
                        List<EntityRefresher> refreshers,
                        @Qualifier(TaskNames.CACHE_REBUILD_TASK) RunTrigger cacheRebuildTrigger,
                        SyncProperties properties) {
        this.syncQueueItemRepository = syncQueueItemRepository;
        this.remoteDataClient = remoteDataClient;
        this.refreshers = new EnumMap<>(EntityType.class);
        for (EntityRefresher refresher : refreshers) {
            if (this.refreshers.put(refresher.entityType(), refresher) != null) {
                throw new IllegalStateException("Duplicate refresher for " + refresher.entityType());
            }
        }
        for (EntityType type : EntityType.values()) {
            if (!this.refreshers.containsKey(type)) {
                throw new IllegalStateException("No refresher for " + type);
            }
        }
        this.cacheRebuildTrigger = cacheRebuildTrigger;
        this.properties = properties;
    }

    @Override
    public void run(TaskContext context) {
        // stays fast until the remote client comes up
        context.setInterval(properties.fastRetryInterval());
        remoteDataClient.initIfNeeded();

        Duration normal = properties.interval();
        int counter = 0;
        try {
            while (counter < properties.getBatchCap() && !context.isCancellationRequested()) {
                Optional<SyncQueueItem> first = syncQueueItemRepository.findFirstByOrderBySyncAtAsc();
                if (first.isEmpty()) {
                    log.debug("No [more] data to sync");
                    context.setInterval(normal);
                    break;
                }
                SyncQueueItem next = first.get();

                Duration wait = Duration.between(Instant.now(), next.getSyncAt());
                if (wait.compareTo(Duration.ZERO) > 0) {
                    log.debug("Next ({} #{}) sync in {} at {}, will wait", next.getEntityType(), next.getIndex(), wait, next.getSyncAt());
                    context.setInterval(wait.compareTo(normal) < 0 ? wait : normal);
                    break;
                }

                counter++;
                process(counter, next);
            }
        } finally {
            // store failures escape the loop; entities refreshed before them are already saved
            if (counter > 0) {
                log.debug("Processed {} queue item(s), requesting cache rebuild", counter);
                cacheRebuildTrigger.tryRunImmediately();
            }
        }
    }

    private void process(int counter, SyncQueueItem next) {
        EntityType type = next.getEntityType();
        long index = next.getIndex();
        try {
            log.debug("Sync #{} ({} #{}) started", counter, type, index);
            Instant lastSync = refreshers.get(type).refresh(index);

            if (EntityRefresher.NOT_FOUND.equals(lastSync)) {
                long deleted = syncQueueItemRepository.deleteByEntityTypeAndIndex(type, index);
                log.warn("Sync #{} ({} #{}) SKIPPED, deleted {} sync item(s) from queue", counter, type, index, deleted);
                return;
            }

            long deleted = syncQueueItemRepository.deleteByEntityTypeAndIndexAndMinLastSyncLessThanEqual(type, index, lastSync);
            log.debug("Sync #{} ({} #{}) done, lastSync={}, deleted {} sync item(s) from queue", counter, type, index, lastSync, deleted);
            if (lastSync.isBefore(next.getMinLastSync())) {
                Duration delay = reschedule(next);
                log.warn("Sync #{} ({} #{}) reached {}, less than required {}, will retry in {}",
                        counter, type, index, lastSync, next.getMinLastSync(), delay);
            }
        } catch (DataAccessResourceFailureException e) {
            throw e;
        } catch (Exception e) {
            Duration delay = reschedule(next);
            log.error("Sync #{} ({} #{}) failed, will retry in {}", counter, type, index, delay, e);
        }
    }

    /** Pushes the item back by the backoff for its retry count; saved as a new row if it was just deleted. */
    private Duration reschedule(SyncQueueItem item) {
        Duration delay = SyncBackoff.delayFor(item.getRetryCount());
        item.setSyncAt(Instant.now().plus(delay));
        item.setRetryCount(item.getRetryCount() + 1);
        syncQueueItemRepository.save(item);
        return delay;
    }
}
