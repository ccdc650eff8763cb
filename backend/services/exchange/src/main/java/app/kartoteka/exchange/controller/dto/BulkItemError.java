package app.kartoteka.exchange.controller.dto;

import java.util.UUID;

public record BulkItemError(
        UUID id,
        String message
) {
}
