package com.daoindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sync queue drain cadence and batch size.
 */
@ConfigurationProperties(prefix = "daoindexer.sync")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Normal polling interval when the queue is empty or the next item is far away. Default 5 min. */
    @Min(1)
    private long intervalMs = 300_000;

    /** Interval used while the remote client is not initialized yet. */
    @Min(1)
    private long fastRetryIntervalMs = 3_000;

    /** Max queue items processed per invocation. */
    @Min(1)
    private int batchCap = 100;

    private long initialDelayMs = 5_000;

    public Duration interval() {
        return Duration.ofMillis(intervalMs);
    }

    public Duration fastRetryInterval() {
        return Duration.ofMillis(fastRetryIntervalMs);
    }
}
