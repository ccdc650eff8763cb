package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientStatus;
import app.kartoteka.exchange.service.mapping.TargetField;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

final class ClientSnapshot {

    static final String STATUS = "status";
    static final String ARCHIVED_AT = "archivedAt";
    static final String TAGS = "tags";
    static final String MANAGER_ID = "managerId";
    static final String DELETED_AT = "deletedAt";

    private ClientSnapshot() {
    }

    static Map<String, Object> capture(ClientEntity client, Collection<String> fields) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String field : fields) {
            values.put(field, read(client, field));
        }
        return values;
    }

    static void restore(ClientEntity client, JsonNode values, ObjectMapper objectMapper) {
        Iterator<Map.Entry<String, JsonNode>> entries = values.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            write(client, entry.getKey(), entry.getValue(), objectMapper);
        }
    }

    private static Object read(ClientEntity client, String field) {
        return switch (field) {
            case STATUS -> client.getStatus() == null ? null : client.getStatus().name();
            case ARCHIVED_AT -> client.getArchivedAt() == null ? null : client.getArchivedAt().toString();
            case DELETED_AT -> client.getDeletedAt() == null ? null : client.getDeletedAt().toString();
            case MANAGER_ID -> client.getManagerId() == null ? null : client.getManagerId().toString();
            case TAGS -> client.getTags() == null ? List.of() : List.copyOf(client.getTags());
            default -> {
                TargetField target = TargetField.parse(field);
                if (target.isCustom()) {
                    yield client.getCustomFields() == null ? null : client.getCustomFields().get(target.customKey());
                }
                yield target.read(client);
            }
        };
    }

    private static void write(ClientEntity client, String field, JsonNode value, ObjectMapper objectMapper) {
        String text = value == null || value.isNull() ? null : value.asText();
        switch (field) {
            case STATUS -> client.setStatus(text == null ? null : ClientStatus.valueOf(text));
            case ARCHIVED_AT -> client.setArchivedAt(text == null ? null : Instant.parse(text));
            case DELETED_AT -> client.setDeletedAt(text == null ? null : Instant.parse(text));
            case MANAGER_ID -> client.setManagerId(text == null ? null : UUID.fromString(text));
            case TAGS -> {
                List<String> tags = new ArrayList<>();
                if (value != null && value.isArray()) {
                    value.forEach(tag -> tags.add(tag.asText()));
                }
                client.setTags(tags);
            }
            default -> {
                TargetField target = TargetField.parse(field);
                if (!target.isCustom()) {
                    target.write(client, text);
                } else if (text == null) {
                    client.getCustomFields().remove(target.customKey());
                } else {
                    client.getCustomFields().put(target.customKey(), toObject(value, objectMapper));
                }
            }
        }
    }

    private static Object toObject(JsonNode value, ObjectMapper objectMapper) {
        try {
            return objectMapper.treeToValue(value, Object.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Snapshot value is not readable", ex);
        }
    }
}
