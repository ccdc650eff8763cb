package app.kartoteka.exchange.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AuditEvent(
        String action,
        UUID tenantId,
        UUID actorId,
        UUID subjectId,
        Map<String, Object> details,
        Instant occurredAt
) {
}
