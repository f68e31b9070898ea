package com.daoindexer.snapshot.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Cache rebuild cadence. Out-of-band rebuilds after sync batches come on top of it.
 */
@ConfigurationProperties(prefix = "daoindexer.cache")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SnapshotProperties {

    /** Default 10 min. */
    @Min(1)
    private long rebuildIntervalMs = 600_000;

    private long initialDelayMs = 1_000;
}
