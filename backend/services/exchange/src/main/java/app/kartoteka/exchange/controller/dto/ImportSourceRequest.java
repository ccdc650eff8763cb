package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.service.mapping.ColumnMapping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.UUID;

public record ImportSourceRequest(
        @NotBlank String sourceKey,
        String fileName,
        @NotNull SourceFormat format,
        @PositiveOrZero Long sizeBytes,
        String encoding,
        @Min(1) Integer headerRows,
        @Valid ColumnMapping mapping,
        UUID mappingTemplateId,
        String duplicateKeyField
) {
}
