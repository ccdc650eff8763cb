package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.domain.RowErrorKind;

public record RowErrorResponse(
        int rowNumber,
        String fieldName,
        RowErrorKind kind,
        String message,
        String rawValue
) {
}
