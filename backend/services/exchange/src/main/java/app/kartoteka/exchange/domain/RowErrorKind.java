package app.kartoteka.exchange.domain;

public enum RowErrorKind {
    REQUIRED,
    INVALID_FORMAT,
    PROCESSING_ERROR
}
