package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.domain.ClientEntity;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StatusChange.class, name = "STATUS_CHANGE"),
        @JsonSubTypes.Type(value = AddTags.class, name = "ADD_TAGS"),
        @JsonSubTypes.Type(value = RemoveTags.class, name = "REMOVE_TAGS"),
        @JsonSubTypes.Type(value = UpdateField.class, name = "UPDATE_FIELD"),
        @JsonSubTypes.Type(value = AssignManager.class, name = "ASSIGN_MANAGER"),
        @JsonSubTypes.Type(value = BatchDelete.class, name = "BATCH_DELETE")
})
public sealed interface BulkOperation
        permits StatusChange, AddTags, RemoveTags, UpdateField, AssignManager, BatchDelete {

    String typeName();

    void validate();

    List<String> affectedFields();

    void apply(ClientEntity client, Instant now);

    default boolean reversible() {
        return true;
    }
}
