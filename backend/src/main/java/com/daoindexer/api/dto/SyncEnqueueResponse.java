package com.daoindexer.api.dto;

import com.daoindexer.domain.EntityType;

import java.time.Instant;

public record SyncEnqueueResponse(String message, EntityType entityType, long index, Instant syncAt) {
}
