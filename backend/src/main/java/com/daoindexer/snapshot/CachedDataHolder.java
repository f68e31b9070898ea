package com.daoindexer.snapshot;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link CachedSnapshot}. Readers call {@link #current()} once per request and work with
 * that reference only.
 */
@Component
public class CachedDataHolder {

    private final AtomicReference<CachedSnapshot> current = new AtomicReference<>(CachedSnapshot.empty());

    public CachedSnapshot current() {
        return current.get();
    }

    void publish(CachedSnapshot snapshot) {
        current.set(Objects.requireNonNull(snapshot, "snapshot"));
    }
}
