package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.service.bulk.BulkOperation;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public record BulkMutationRequest(
        @NotNull BulkOperation operation,
        @NotEmpty List<UUID> ids
) {
}
