package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.domain.ClientEntity;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record AddTags(List<String> tagIds) implements BulkOperation {

    @Override
    public String typeName() {
        return "ADD_TAGS";
    }

    @Override
    public void validate() {
        if (tagIds == null || tagIds.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "tagIds must not be empty");
        }
    }

    @Override
    public List<String> affectedFields() {
        return List.of(ClientSnapshot.TAGS);
    }

    @Override
    public void apply(ClientEntity client, Instant now) {
        List<String> tags = client.getTags() == null ? new ArrayList<>() : new ArrayList<>(client.getTags());
        for (String tagId : tagIds) {
            if (!tags.contains(tagId)) {
                tags.add(tagId);
            }
        }
        client.setTags(tags);
    }
}
