package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.service.mapping.ColumnMapping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record MappingTemplateRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 500) String description,
        @NotNull @Valid ColumnMapping mapping,
        String duplicateKeyField
) {
}
