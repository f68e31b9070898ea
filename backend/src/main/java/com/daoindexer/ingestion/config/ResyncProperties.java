package com.daoindexer.ingestion.config;

import com.daoindexer.domain.EntityType;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Maximum age of an entity's {@code lastSync} before it is re-enqueued, per entity type.
 */
@ConfigurationProperties(prefix = "daoindexer.resync")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ResyncProperties {

    @Min(1)
    private long adminMs = 86_400_000;

    @Min(1)
    private long userMs = 43_200_000;

    @Min(1)
    private long orderMs = 7_200_000;

    /** How often stale entities are looked for. */
    @Min(1)
    private long checkIntervalMs = 900_000;

    private long initialDelayMs = 60_000;

    public Duration intervalFor(EntityType type) {
        return switch (type) {
            case ADMIN -> Duration.ofMillis(adminMs);
            case USER -> Duration.ofMillis(userMs);
            case ORDER -> Duration.ofMillis(orderMs);
        };
    }
}
