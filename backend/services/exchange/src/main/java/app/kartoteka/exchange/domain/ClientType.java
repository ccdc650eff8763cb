package app.kartoteka.exchange.domain;

public enum ClientType {
    COMPANY,
    INDIVIDUAL
}
