package app.kartoteka.exchange.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum ClientField {
    COMPANY_NAME("companyName", FieldType.TEXT, ClientEntity::getCompanyName, ClientEntity::setCompanyName),
    FIRST_NAME("firstName", FieldType.TEXT, ClientEntity::getFirstName, ClientEntity::setFirstName),
    LAST_NAME("lastName", FieldType.TEXT, ClientEntity::getLastName, ClientEntity::setLastName),
    NIP("nip", FieldType.TAX_ID, ClientEntity::getNip, ClientEntity::setNip),
    REGON("regon", FieldType.REGISTRY_ID, ClientEntity::getRegon, ClientEntity::setRegon),
    PESEL("pesel", FieldType.PERSONAL_ID, ClientEntity::getPesel, ClientEntity::setPesel),
    KRS("krs", FieldType.TEXT, ClientEntity::getKrs, ClientEntity::setKrs),
    EMAIL("email", FieldType.EMAIL, ClientEntity::getEmail, ClientEntity::setEmail),
    PHONE("phone", FieldType.PHONE, ClientEntity::getPhone, ClientEntity::setPhone),
    WEBSITE("website", FieldType.TEXT, ClientEntity::getWebsite, ClientEntity::setWebsite),
    STREET("street", FieldType.TEXT, ClientEntity::getStreet, ClientEntity::setStreet),
    BUILDING_NUMBER("buildingNumber", FieldType.TEXT, ClientEntity::getBuildingNumber, ClientEntity::setBuildingNumber),
    APARTMENT_NUMBER("apartmentNumber", FieldType.TEXT, ClientEntity::getApartmentNumber, ClientEntity::setApartmentNumber),
    POSTAL_CODE("postalCode", FieldType.POSTAL_CODE, ClientEntity::getPostalCode, ClientEntity::setPostalCode),
    CITY("city", FieldType.TEXT, ClientEntity::getCity, ClientEntity::setCity),
    VOIVODESHIP("voivodeship", FieldType.TEXT, ClientEntity::getVoivodeship, ClientEntity::setVoivodeship),
    COUNTRY("country", FieldType.TEXT, ClientEntity::getCountry, ClientEntity::setCountry),
    NOTES("notes", FieldType.TEXT, ClientEntity::getNotes, ClientEntity::setNotes);

    private static final Map<String, ClientField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toMap(field -> field.key.toLowerCase(Locale.ROOT), Function.identity()));

    private final String key;
    private final FieldType type;
    private final Function<ClientEntity, String> getter;
    private final BiConsumer<ClientEntity, String> setter;

    ClientField(String key,
                FieldType type,
                Function<ClientEntity, String> getter,
                BiConsumer<ClientEntity, String> setter) {
        this.key = key;
        this.type = type;
        this.getter = getter;
        this.setter = setter;
    }

    public String key() {
        return key;
    }

    public FieldType type() {
        return type;
    }

    public String read(ClientEntity client) {
        return getter.apply(client);
    }

    public void write(ClientEntity client, String value) {
        setter.accept(client, value);
    }

    public static Optional<ClientField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        ClientField byKey = BY_KEY.get(normalized);
        if (byKey != null) {
            return Optional.of(byKey);
        }
        return Arrays.stream(values())
                .filter(field -> field.name().equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
