package app.kartoteka.exchange.service.mapping;

import java.util.Locale;

public enum Transformation {
    NONE,
    UPPERCASE,
    LOWERCASE,
    TRIM,
    STRIP_FORMATTING;

    public String apply(String value) {
        if (value == null) {
            return null;
        }
        return switch (this) {
            case NONE -> value;
            case UPPERCASE -> value.toUpperCase(Locale.ROOT);
            case LOWERCASE -> value.toLowerCase(Locale.ROOT);
            case TRIM -> value.trim();
            case STRIP_FORMATTING -> value.replaceAll("[\\s\\-]", "");
        };
    }
}
