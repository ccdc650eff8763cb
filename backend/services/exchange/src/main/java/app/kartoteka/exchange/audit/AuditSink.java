package app.kartoteka.exchange.audit;

public interface AuditSink {
    void deliver(AuditEvent event);
}
