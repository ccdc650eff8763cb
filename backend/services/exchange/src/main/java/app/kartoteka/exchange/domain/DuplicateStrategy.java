package app.kartoteka.exchange.domain;

public enum DuplicateStrategy {
    SKIP,
    UPDATE,
    CREATE_NEW
}
