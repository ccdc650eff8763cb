package app.kartoteka.exchange.controller.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BulkReversalResponse(
        UUID mutationId,
        int restored,
        int failed,
        List<BulkItemError> errors,
        Instant reversedAt
) {
}
