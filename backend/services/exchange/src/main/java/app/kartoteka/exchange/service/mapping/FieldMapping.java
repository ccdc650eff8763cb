package app.kartoteka.exchange.service.mapping;

import jakarta.validation.constraints.NotBlank;

public record FieldMapping(
        @NotBlank String sourceColumn,
        @NotBlank String targetField,
        Transformation transformation,
        String defaultValue,
        boolean required
) {
    public FieldMapping {
        if (transformation == null) {
            transformation = Transformation.NONE;
        }
    }
}
