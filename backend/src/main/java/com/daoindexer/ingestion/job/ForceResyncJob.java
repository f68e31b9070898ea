package com.daoindexer.ingestion.job;

import com.daoindexer.common.RecurringWork;
import com.daoindexer.common.TaskContext;
import com.daoindexer.domain.AdminRepository;
import com.daoindexer.domain.EntityType;
import com.daoindexer.domain.OrderRepository;
import com.daoindexer.domain.Setting;
import com.daoindexer.domain.SettingRepository;
import com.daoindexer.domain.TrackedEntity;
import com.daoindexer.domain.TrackedEntityRepository;
import com.daoindexer.domain.UserRepository;
import com.daoindexer.ingestion.config.ResyncProperties;
import com.daoindexer.ingestion.queue.SyncQueueService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Periodically enqueues every entity whose {@code lastSync} is older than the force-resync interval of
 * its type. Entities that already have a queue row and the master placeholder rows are skipped.
 */
@Component
@Slf4j
public class ForceResyncJob implements RecurringWork {

    private final Map<EntityType, TrackedEntityRepository<? extends TrackedEntity>> repositories;
    private final SyncQueueService syncQueueService;
    private final ResyncProperties resyncProperties;
    private final SettingRepository settingRepository;

    public ForceResyncJob(AdminRepository adminRepository,
                          UserRepository userRepository,
                          OrderRepository orderRepository,
                          SyncQueueService syncQueueService,
                          ResyncProperties resyncProperties,
                          SettingRepository settingRepository) {
        this.repositories = new EnumMap<>(EntityType.class);
        this.repositories.put(EntityType.ADMIN, adminRepository);
        this.repositories.put(EntityType.USER, userRepository);
        this.repositories.put(EntityType.ORDER, orderRepository);
        this.syncQueueService = syncQueueService;
        this.resyncProperties = resyncProperties;
        this.settingRepository = settingRepository;
    }

    @Override
    public void run(TaskContext context) {
        Instant now = Instant.now();
        String master = settingRepository.findById(Setting.MASTER_ADDRESS).map(Setting::getStringValue).orElse(null);
        int total = 0;
        for (EntityType type : EntityType.values()) {
            if (context.isCancellationRequested()) {
                break;
            }
            total += enqueueStale(type, now, master);
        }
        if (total > 0) {
            log.info("Force-resync enqueued {} stale entities", total);
        } else {
            log.debug("Force-resync found nothing stale");
        }
    }

    int enqueueStale(EntityType type, Instant now, String master) {
        Instant cutoff = now.minus(resyncProperties.intervalFor(type));
        List<? extends TrackedEntity> stale = repositories.get(type).findByLastSyncBeforeOrLastSyncIsNull(cutoff);
        int count = 0;
        for (TrackedEntity entity : stale) {
            if (master != null && master.equals(entity.ownerAddress())) {
                continue;
            }
            if (syncQueueService.isQueued(type, entity.getIndex())) {
                continue;
            }
            syncQueueService.enqueue(type, entity.getIndex(), now);
            count++;
        }
        if (count > 0) {
            log.debug("{} {} entities older than {} enqueued", count, type, cutoff);
        }
        return count;
    }
}
