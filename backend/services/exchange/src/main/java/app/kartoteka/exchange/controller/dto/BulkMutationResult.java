package app.kartoteka.exchange.controller.dto;

import java.util.List;
import java.util.UUID;

public record BulkMutationResult(
        UUID mutationId,
        int successful,
        int failed,
        List<BulkItemError> errors
) {
}
