package app.kartoteka.exchange.service.parser;

import java.util.Map;

public record ImportRecord(
        int rowNumber,
        Map<String, String> fields
) {
}
