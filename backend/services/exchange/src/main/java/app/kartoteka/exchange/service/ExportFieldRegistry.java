package app.kartoteka.exchange.service;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientField;
import app.kartoteka.exchange.service.mapping.TargetField;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

@Component
public class ExportFieldRegistry {

    public record ExportColumn(String name, Function<ClientEntity, String> extractor) {
        public String extract(ClientEntity client) {
            String value = extractor.apply(client);
            return value == null ? "" : value;
        }
    }

    private final Map<String, Function<ClientEntity, String>> extractors = new LinkedHashMap<>();
    private final List<String> defaultFields;

    public ExportFieldRegistry(@Value("${app.exchange.export.default-fields:displayName,type,status,nip,regon,email,phone,postalCode,city,tags}")
                               String defaultFields) {
        extractors.put("id", client -> Objects.toString(client.getClientId(), null));
        extractors.put("displayName", ClientEntity::getDisplayName);
        extractors.put("type", client -> client.getClientType() == null ? null : client.getClientType().name());
        extractors.put("status", client -> client.getStatus() == null ? null : client.getStatus().name());
        for (ClientField field : ClientField.values()) {
            extractors.put(field.key(), field::read);
        }
        extractors.put("tags", client -> client.getTags() == null ? null : String.join(";", client.getTags()));
        extractors.put("managerId", client -> Objects.toString(client.getManagerId(), null));
        extractors.put("createdAt", client -> Objects.toString(client.getCreatedAt(), null));
        extractors.put("updatedAt", client -> Objects.toString(client.getUpdatedAt(), null));
        this.defaultFields = Arrays.stream(defaultFields.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }

    public List<String> defaultFields() {
        return defaultFields;
    }

    public List<ExportColumn> resolve(List<String> names) {
        List<String> requested = names == null || names.isEmpty() ? defaultFields : names;
        List<ExportColumn> columns = new ArrayList<>(requested.size());
        for (String raw : requested) {
            String name = raw == null ? "" : raw.trim();
            if (name.startsWith(TargetField.CUSTOM_PREFIX)) {
                TargetField custom = TargetField.parse(name);
                columns.add(new ExportColumn(custom.name(), custom::read));
                continue;
            }
            Function<ClientEntity, String> extractor = extractors.get(name);
            if (extractor == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown export field: " + name);
            }
            columns.add(new ExportColumn(name, extractor));
        }
        return columns;
    }
}
