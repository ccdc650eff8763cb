package app.kartoteka.exchange.domain;

public enum FieldType {
    TEXT,
    TAX_ID,
    REGISTRY_ID,
    PERSONAL_ID,
    EMAIL,
    POSTAL_CODE,
    PHONE
}
