package app.kartoteka.exchange.service.mapping;

import app.kartoteka.exchange.domain.ClientEntity;

import java.util.Map;

public record ResolvedRecord(
        int rowNumber,
        Map<TargetField, String> values,
        Map<TargetField, String> rawValues
) {
    public String value(TargetField target) {
        return values.get(target);
    }

    public String rawValue(TargetField target) {
        return rawValues.get(target);
    }

    public void applyTo(ClientEntity client) {
        values.forEach((target, value) -> target.write(client, value));
    }
}
