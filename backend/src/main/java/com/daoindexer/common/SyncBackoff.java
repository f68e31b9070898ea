package com.daoindexer.common;

import java.time.Duration;
import java.util.List;

/**
 * Retry delays for sync queue items, indexed by retry count and saturating at the last entry.
 */
public final class SyncBackoff {

    private static final List<Duration> DELAYS = List.of(
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(10),
            Duration.ofSeconds(15),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60),
            Duration.ofMinutes(2),
            Duration.ofMinutes(5),
            Duration.ofMinutes(10),
            Duration.ofMinutes(30),
            Duration.ofHours(1),
            Duration.ofHours(4),
            Duration.ofHours(13));

    private SyncBackoff() {
    }

    /**
     * Delay before the next attempt of an item that already failed {@code retryCount} times.
     * Negative counts are treated as zero.
     */
    public static Duration delayFor(int retryCount) {
        int i = Math.min(Math.max(retryCount, 0), DELAYS.size() - 1);
        return DELAYS.get(i);
    }
}
