package app.kartoteka.exchange.service.validation;

import app.kartoteka.exchange.domain.RowErrorKind;

public record RowIssue(
        int rowNumber,
        String fieldName,
        RowErrorKind kind,
        String message,
        String rawValue
) {
}
