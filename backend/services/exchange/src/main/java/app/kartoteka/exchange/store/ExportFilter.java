package app.kartoteka.exchange.store;

import app.kartoteka.exchange.domain.ClientStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ExportFilter(
        List<ClientStatus> statuses,
        List<String> tagIds,
        Instant createdFrom,
        Instant createdTo,
        String search,
        Map<String, String> customFields,
        String sortBy,
        String sortDirection
) {
    public static ExportFilter empty() {
        return new ExportFilter(null, null, null, null, null, null, null, null);
    }
}
