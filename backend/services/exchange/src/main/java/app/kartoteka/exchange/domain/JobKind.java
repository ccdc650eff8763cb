package app.kartoteka.exchange.domain;

public enum JobKind {
    IMPORT,
    EXPORT
}
