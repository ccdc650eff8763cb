package app.kartoteka.exchange.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record BulkMutationResponse(
        UUID mutationId,
        String operationType,
        JsonNode operation,
        UUID actorId,
        int targetCount,
        int successful,
        int failed,
        JsonNode errors,
        boolean reversible,
        Instant reversedAt,
        UUID reversedBy,
        Instant createdAt
) {
}
