package com.daoindexer.ingestion.refresh;

import com.daoindexer.domain.TrackedEntity;
import com.daoindexer.domain.TrackedEntityRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;

/**
 * Load, parse a copy, persist. The stored row is replaced only when parsing succeeded and the new
 * {@code lastSync} does not go backwards; a regressing result is returned unsaved so the caller retries.
 */
@Slf4j
public abstract class AbstractEntityRefresher<T extends TrackedEntity> implements EntityRefresher {

    private final TrackedEntityRepository<T> repository;

    protected AbstractEntityRefresher(TrackedEntityRepository<T> repository) {
        this.repository = repository;
    }

    protected abstract T copyOf(T stored);

    protected abstract void parse(T copy);

    @Override
    public Instant refresh(long index) {
        Optional<T> found = repository.findById(index);
        if (found.isEmpty()) {
            log.warn("{} #{} was not found, nothing to sync", entityType(), index);
            return NOT_FOUND;
        }
        T stored = found.get();
        T copy = copyOf(stored);
        parse(copy);

        Instant achieved = copy.getLastSync();
        if (achieved == null) {
            throw new EntityRefreshException(entityType(), index, "parser did not set lastSync");
        }
        Instant previous = stored.getLastSync();
        if (previous != null && achieved.isBefore(previous)) {
            log.warn("{} #{} refresh returned {} older than stored {}, not saved", entityType(), index, achieved, previous);
            return achieved;
        }
        repository.save(copy);
        return achieved;
    }
}
