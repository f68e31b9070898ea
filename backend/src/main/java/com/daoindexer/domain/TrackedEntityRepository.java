package com.daoindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.time.Instant;
import java.util.List;

/**
 * Common queries of the admins, users and orders collections.
 */
@NoRepositoryBean
public interface TrackedEntityRepository<T extends TrackedEntity> extends MongoRepository<T, Long> {

    /** Entities never synced or synced before the cutoff. Used by force-resync. */
    List<T> findByLastSyncBeforeOrLastSyncIsNull(Instant cutoff);
}
