package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.domain.ClientEntity;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AssignManager(UUID managerId) implements BulkOperation {

    @Override
    public String typeName() {
        return "ASSIGN_MANAGER";
    }

    @Override
    public void validate() {
    }

    @Override
    public List<String> affectedFields() {
        return List.of(ClientSnapshot.MANAGER_ID);
    }

    @Override
    public void apply(ClientEntity client, Instant now) {
        client.setManagerId(managerId);
    }
}
