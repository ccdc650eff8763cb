package app.kartoteka.exchange.service.mapping;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ColumnMapping(
        @Valid List<FieldMapping> fields
) {
    public ColumnMapping {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ColumnMapping empty() {
        return new ColumnMapping(List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public ColumnMapping overriddenBy(ColumnMapping overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, FieldMapping> merged = new LinkedHashMap<>();
        for (FieldMapping field : fields) {
            merged.put(field.sourceColumn(), field);
        }
        for (FieldMapping field : overrides.fields()) {
            merged.put(field.sourceColumn(), field);
        }
        return new ColumnMapping(new ArrayList<>(merged.values()));
    }
}
