package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.domain.ClientEntity;

import java.time.Instant;
import java.util.List;

public record BatchDelete(boolean hard) implements BulkOperation {

    @Override
    public String typeName() {
        return "BATCH_DELETE";
    }

    @Override
    public void validate() {
    }

    @Override
    public List<String> affectedFields() {
        return List.of(ClientSnapshot.DELETED_AT);
    }

    @Override
    public void apply(ClientEntity client, Instant now) {
        client.setDeletedAt(now);
    }

    @Override
    public boolean reversible() {
        return !hard;
    }
}
