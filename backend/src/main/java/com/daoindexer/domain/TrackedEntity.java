package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Local mirror of one contract. {@code index} and {@code address} never change once assigned;
 * {@code lastSync} only moves forward.
 */
@NoArgsConstructor
@Getter
@Setter
public abstract class TrackedEntity {

    @Id
    private Long index;
    /** Contract address. */
    private String address;
    /** Remote time the stored fields are known correct as of. */
    private Instant lastSync;
    private Instant createdAt;

    protected TrackedEntity(TrackedEntity source) {
        this.index = source.index;
        this.address = source.address;
        this.lastSync = source.lastSync;
        this.createdAt = source.createdAt;
    }

    public abstract EntityType entityType();

    /**
     * Address of the account that owns this entity. Equals the master contract address on the placeholder
     * row that stands for the master contract itself.
     */
    public abstract String ownerAddress();
}
