package app.kartoteka.exchange.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Component
public class AuditPublisher {

    private static final Logger log = LoggerFactory.getLogger(AuditPublisher.class);

    private final AuditSink sink;

    public AuditPublisher(AuditSink sink) {
        this.sink = sink;
    }

    public void publish(String action, UUID tenantId, UUID actorId, UUID subjectId, Map<String, Object> details) {
        AuditEvent event = new AuditEvent(
                action,
                tenantId,
                actorId,
                subjectId,
                details == null ? Map.of() : details,
                Instant.now()
        );
        try {
            sink.deliver(event);
        } catch (RuntimeException ex) {
            log.warn("Audit delivery failed action={} subjectId={} error={}", action, subjectId, ex.getMessage());
        }
    }
}
