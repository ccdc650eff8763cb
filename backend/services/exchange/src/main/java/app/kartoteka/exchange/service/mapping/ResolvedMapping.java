package app.kartoteka.exchange.service.mapping;

import app.kartoteka.exchange.service.parser.ImportRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ResolvedMapping(
        List<Column> columns
) {
    public record Column(FieldMapping mapping, TargetField target) {
    }

    public List<TargetField> requiredTargets() {
        return columns.stream()
                .filter(column -> column.mapping().required())
                .map(Column::target)
                .toList();
    }

    public ResolvedRecord apply(ImportRecord record) {
        Map<TargetField, String> values = new LinkedHashMap<>();
        Map<TargetField, String> raw = new LinkedHashMap<>();
        for (Column column : columns) {
            FieldMapping mapping = column.mapping();
            String source = record.fields().get(mapping.sourceColumn().trim());
            String value = isEmpty(source) ? mapping.defaultValue() : source;
            value = mapping.transformation().apply(value);
            raw.put(column.target(), source);
            if (!isEmpty(value)) {
                values.put(column.target(), value);
            }
        }
        return new ResolvedRecord(record.rowNumber(), values, raw);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
