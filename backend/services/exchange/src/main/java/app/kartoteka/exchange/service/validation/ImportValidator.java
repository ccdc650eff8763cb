package app.kartoteka.exchange.service.validation;

import app.kartoteka.exchange.domain.FieldType;
import app.kartoteka.exchange.domain.RowErrorKind;
import app.kartoteka.exchange.service.mapping.ResolvedMapping;
import app.kartoteka.exchange.service.mapping.ResolvedRecord;
import app.kartoteka.exchange.service.mapping.TargetField;
import app.kartoteka.exchange.service.parser.ImportStream;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class ImportValidator {

    public ValidationReport validate(ImportStream stream,
                                     ResolvedMapping mapping,
                                     TargetField keyField,
                                     Map<String, UUID> existingKeys) {
        List<RowIssue> errors = new ArrayList<>();
        List<DuplicateFinding> duplicates = new ArrayList<>();
        Map<String, Integer> firstOccurrence = new HashMap<>();
        int total = 0;
        int valid = 0;

        while (stream.hasNext()) {
            ResolvedRecord record = mapping.apply(stream.next());
            total++;
            List<RowIssue> rowIssues = checkRow(record, mapping);
            if (rowIssues.isEmpty()) {
                valid++;
            } else {
                errors.addAll(rowIssues);
            }
            String key = keyField == null ? null : record.value(keyField);
            if (key == null) {
                continue;
            }
            Integer firstRow = firstOccurrence.putIfAbsent(key, record.rowNumber());
            UUID existingId = existingKeys == null ? null : existingKeys.get(key);
            if (firstRow != null || existingId != null) {
                duplicates.add(new DuplicateFinding(
                        record.rowNumber(),
                        key,
                        firstRow != null,
                        firstRow,
                        existingId != null,
                        existingId
                ));
            }
        }
        return new ValidationReport(errors.isEmpty(), List.copyOf(errors), List.copyOf(duplicates), valid, total);
    }

    public List<RowIssue> checkRow(ResolvedRecord record, ResolvedMapping mapping) {
        List<RowIssue> issues = new ArrayList<>();
        for (TargetField required : mapping.requiredTargets()) {
            if (record.value(required) == null) {
                issues.add(new RowIssue(
                        record.rowNumber(),
                        required.name(),
                        RowErrorKind.REQUIRED,
                        "Field " + required.name() + " is required",
                        record.rawValue(required)
                ));
            }
        }
        record.values().forEach((target, value) -> {
            String problem = formatProblem(target.type(), value);
            if (problem != null) {
                issues.add(new RowIssue(
                        record.rowNumber(),
                        target.name(),
                        RowErrorKind.INVALID_FORMAT,
                        problem,
                        record.rawValue(target)
                ));
            }
        });
        return issues;
    }

    private String formatProblem(FieldType type, String value) {
        return switch (type) {
            case TEXT -> null;
            case TAX_ID -> IdentifierChecksums.isValidNip(value) ? null : "Invalid NIP: expected 10 digits with a valid checksum";
            case REGISTRY_ID -> IdentifierChecksums.isValidRegon(value) ? null : "Invalid REGON: expected 9 or 14 digits with a valid checksum";
            case PERSONAL_ID -> IdentifierChecksums.isValidPesel(value) ? null : "Invalid PESEL: expected 11 digits with a valid checksum";
            case EMAIL -> IdentifierChecksums.isValidEmail(value) ? null : "Invalid email address";
            case POSTAL_CODE -> IdentifierChecksums.isValidPostalCode(value) ? null : "Invalid postal code: expected DD-DDD";
            case PHONE -> IdentifierChecksums.isValidPhone(value) ? null : "Invalid phone number";
        };
    }
}
