package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

public record StatusChange(ClientStatus newStatus, String reason) implements BulkOperation {

    @Override
    public String typeName() {
        return "STATUS_CHANGE";
    }

    @Override
    public void validate() {
        if (newStatus == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "newStatus is required");
        }
    }

    @Override
    public List<String> affectedFields() {
        return List.of(ClientSnapshot.STATUS, ClientSnapshot.ARCHIVED_AT);
    }

    @Override
    public void apply(ClientEntity client, Instant now) {
        if (newStatus == ClientStatus.ARCHIVED && client.getStatus() != ClientStatus.ARCHIVED) {
            client.setArchivedAt(now);
        } else if (newStatus != ClientStatus.ARCHIVED) {
            client.setArchivedAt(null);
        }
        client.setStatus(newStatus);
    }
}
