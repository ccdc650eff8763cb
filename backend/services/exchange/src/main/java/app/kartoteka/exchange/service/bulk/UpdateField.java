package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.FieldType;
import app.kartoteka.exchange.service.mapping.TargetField;
import app.kartoteka.exchange.service.validation.IdentifierChecksums;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

public record UpdateField(String fieldName, String value) implements BulkOperation {

    @Override
    public String typeName() {
        return "UPDATE_FIELD";
    }

    @Override
    public void validate() {
        TargetField target = target();
        if (value == null || value.isBlank()) {
            return;
        }
        if (!matchesType(target.type(), value.trim())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid value for " + target.name());
        }
    }

    @Override
    public List<String> affectedFields() {
        return List.of(target().name());
    }

    @Override
    public void apply(ClientEntity client, Instant now) {
        target().write(client, value == null || value.isBlank() ? null : value.trim());
    }

    private TargetField target() {
        return TargetField.parse(fieldName);
    }

    private static boolean matchesType(FieldType type, String value) {
        return switch (type) {
            case TEXT -> true;
            case TAX_ID -> IdentifierChecksums.isValidNip(value);
            case REGISTRY_ID -> IdentifierChecksums.isValidRegon(value);
            case PERSONAL_ID -> IdentifierChecksums.isValidPesel(value);
            case EMAIL -> IdentifierChecksums.isValidEmail(value);
            case POSTAL_CODE -> IdentifierChecksums.isValidPostalCode(value);
            case PHONE -> IdentifierChecksums.isValidPhone(value);
        };
    }
}
