package app.kartoteka.exchange.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "bulk_mutations", schema = "app_exchange")
public class BulkMutationEntity {

    @Id
    @Column(name = "mutation_id", nullable = false)
    private UUID mutationId;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "actor_id", nullable = false)
    private UUID actorId;

    @Column(name = "operation_type", nullable = false)
    private String operationType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "operation", columnDefinition = "jsonb", nullable = false)
    private JsonNode operation;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "target_ids", columnDefinition = "jsonb", nullable = false)
    private JsonNode targetIds;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "snapshot", columnDefinition = "jsonb")
    private JsonNode snapshot;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "errors", columnDefinition = "jsonb")
    private JsonNode errors;

    @Column(name = "successful_count", nullable = false)
    private int successfulCount;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Column(name = "reversible", nullable = false)
    private boolean reversible;

    @Column(name = "reversed_at")
    private Instant reversedAt;

    @Column(name = "reversed_by")
    private UUID reversedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public BulkMutationEntity() {
    }

    public UUID getMutationId() {
        return mutationId;
    }

    public void setMutationId(UUID mutationId) {
        this.mutationId = mutationId;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public UUID getActorId() {
        return actorId;
    }

    public void setActorId(UUID actorId) {
        this.actorId = actorId;
    }

    public String getOperationType() {
        return operationType;
    }

    public void setOperationType(String operationType) {
        this.operationType = operationType;
    }

    public JsonNode getOperation() {
        return operation;
    }

    public void setOperation(JsonNode operation) {
        this.operation = operation;
    }

    public JsonNode getTargetIds() {
        return targetIds;
    }

    public void setTargetIds(JsonNode targetIds) {
        this.targetIds = targetIds;
    }

    public JsonNode getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(JsonNode snapshot) {
        this.snapshot = snapshot;
    }

    public JsonNode getErrors() {
        return errors;
    }

    public void setErrors(JsonNode errors) {
        this.errors = errors;
    }

    public int getSuccessfulCount() {
        return successfulCount;
    }

    public void setSuccessfulCount(int successfulCount) {
        this.successfulCount = successfulCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public void setFailedCount(int failedCount) {
        this.failedCount = failedCount;
    }

    public boolean isReversible() {
        return reversible;
    }

    public void setReversible(boolean reversible) {
        this.reversible = reversible;
    }

    public Instant getReversedAt() {
        return reversedAt;
    }

    public void setReversedAt(Instant reversedAt) {
        this.reversedAt = reversedAt;
    }

    public UUID getReversedBy() {
        return reversedBy;
    }

    public void setReversedBy(UUID reversedBy) {
        this.reversedBy = reversedBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
