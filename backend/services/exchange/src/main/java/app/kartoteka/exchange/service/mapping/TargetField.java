package app.kartoteka.exchange.service.mapping;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientField;
import app.kartoteka.exchange.domain.FieldType;

public record TargetField(
        String name,
        ClientField field,
        String customKey
) {
    public static final String CUSTOM_PREFIX = "customFields.";

    public static TargetField parse(String name) {
        if (name == null || name.isBlank()) {
            throw new MappingException("Target field is required");
        }
        String trimmed = name.trim();
        if (trimmed.startsWith(CUSTOM_PREFIX)) {
            String key = trimmed.substring(CUSTOM_PREFIX.length()).trim();
            if (key.isEmpty()) {
                throw new MappingException("Custom field key is missing in '" + trimmed + "'");
            }
            return new TargetField(CUSTOM_PREFIX + key, null, key);
        }
        return ClientField.fromKey(trimmed)
                .map(field -> new TargetField(field.key(), field, null))
                .orElseThrow(() -> new MappingException("Unknown target field: " + trimmed));
    }

    public static TargetField of(ClientField field) {
        return new TargetField(field.key(), field, null);
    }

    public boolean isCustom() {
        return field == null;
    }

    public FieldType type() {
        return isCustom() ? FieldType.TEXT : field.type();
    }

    public String read(ClientEntity client) {
        if (isCustom()) {
            Object value = client.getCustomFields() == null ? null : client.getCustomFields().get(customKey);
            return value == null ? null : value.toString();
        }
        return field.read(client);
    }

    public void write(ClientEntity client, String value) {
        if (isCustom()) {
            client.getCustomFields().put(customKey, value);
        } else {
            field.write(client, value);
        }
    }
}
