package com.daoindexer.api.controller;

import com.daoindexer.api.dto.ErrorBody;
import com.daoindexer.api.dto.SyncEnqueueResponse;
import com.daoindexer.domain.EntityType;
import com.daoindexer.domain.SyncQueueItem;
import com.daoindexer.ingestion.queue.SyncQueueService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.Optional;

/**
 * POST /sync/{entityType}/{index}: queues a refresh of one entity, due now.
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncQueueService syncQueueService;

    @PostMapping("/{entityType}/{index}")
    public ResponseEntity<?> enqueue(@PathVariable String entityType, @PathVariable long index) {
        Optional<EntityType> type = Arrays.stream(EntityType.values())
                .filter(t -> t.name().equalsIgnoreCase(entityType))
                .findFirst();
        if (type.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ENTITY_TYPE",
                    "entityType must be one of admin, user, order"));
        }
        if (index < 0) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_INDEX",
                    "index must be 0 or greater"));
        }
        SyncQueueItem item = syncQueueService.enqueue(type.get(), index);
        return ResponseEntity.accepted().body(new SyncEnqueueResponse("Sync queued", item.getEntityType(), item.getIndex(), item.getSyncAt()));
    }
}
