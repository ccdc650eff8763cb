package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.domain.DuplicateStrategy;
import jakarta.validation.Valid;

import java.util.UUID;

public record CreateImportJobRequest(
        UUID validationJobId,
        @Valid ImportSourceRequest source,
        DuplicateStrategy duplicateStrategy,
        boolean failOnValidationErrors
) {
}
