package app.kartoteka.exchange.domain;

public enum ClientStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    ARCHIVED
}
