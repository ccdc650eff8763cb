package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.service.mapping.ColumnMapping;

import java.time.Instant;
import java.util.UUID;

public record MappingTemplateResponse(
        UUID templateId,
        String name,
        String description,
        ColumnMapping mapping,
        String duplicateKeyField,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt
) {
}
