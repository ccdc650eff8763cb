package app.kartoteka.exchange.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "exchange_jobs", schema = "app_exchange")
public class ExchangeJobEntity {

    @Id
    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_kind", nullable = false)
    private JobKind jobKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private JobStatus status;

    @Column(name = "source_name")
    private String sourceName;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_format")
    private SourceFormat sourceFormat;

    @Column(name = "source_size_bytes")
    private Long sourceSizeBytes;

    @Column(name = "source_key")
    private String sourceKey;

    @Column(name = "source_encoding")
    private String sourceEncoding;

    @Column(name = "header_rows", nullable = false)
    private int headerRows;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "field_mapping", columnDefinition = "jsonb")
    private JsonNode fieldMapping;

    @Enumerated(EnumType.STRING)
    @Column(name = "duplicate_strategy")
    private DuplicateStrategy duplicateStrategy;

    @Column(name = "duplicate_key_field")
    private String duplicateKeyField;

    @Column(name = "fail_on_validation", nullable = false)
    private boolean failOnValidation;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "export_filter", columnDefinition = "jsonb")
    private JsonNode exportFilter;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "export_fields", columnDefinition = "jsonb")
    private JsonNode exportFields;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "processed_items", nullable = false)
    private int processedItems;

    @Column(name = "successful_items", nullable = false)
    private int successfulItems;

    @Column(name = "failed_items", nullable = false)
    private int failedItems;

    @Column(name = "skipped_items", nullable = false)
    private int skippedItems;

    @Column(name = "result_key")
    private String resultKey;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "queued_at")
    private Instant queuedAt;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ExchangeJobEntity() {
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(UUID ownerId) {
        this.ownerId = ownerId;
    }

    public JobKind getJobKind() {
        return jobKind;
    }

    public void setJobKind(JobKind jobKind) {
        this.jobKind = jobKind;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    public void setSourceFormat(SourceFormat sourceFormat) {
        this.sourceFormat = sourceFormat;
    }

    public Long getSourceSizeBytes() {
        return sourceSizeBytes;
    }

    public void setSourceSizeBytes(Long sourceSizeBytes) {
        this.sourceSizeBytes = sourceSizeBytes;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public void setSourceKey(String sourceKey) {
        this.sourceKey = sourceKey;
    }

    public String getSourceEncoding() {
        return sourceEncoding;
    }

    public void setSourceEncoding(String sourceEncoding) {
        this.sourceEncoding = sourceEncoding;
    }

    public int getHeaderRows() {
        return headerRows;
    }

    public void setHeaderRows(int headerRows) {
        this.headerRows = headerRows;
    }

    public JsonNode getFieldMapping() {
        return fieldMapping;
    }

    public void setFieldMapping(JsonNode fieldMapping) {
        this.fieldMapping = fieldMapping;
    }

    public DuplicateStrategy getDuplicateStrategy() {
        return duplicateStrategy;
    }

    public void setDuplicateStrategy(DuplicateStrategy duplicateStrategy) {
        this.duplicateStrategy = duplicateStrategy;
    }

    public String getDuplicateKeyField() {
        return duplicateKeyField;
    }

    public void setDuplicateKeyField(String duplicateKeyField) {
        this.duplicateKeyField = duplicateKeyField;
    }

    public boolean isFailOnValidation() {
        return failOnValidation;
    }

    public void setFailOnValidation(boolean failOnValidation) {
        this.failOnValidation = failOnValidation;
    }

    public JsonNode getExportFilter() {
        return exportFilter;
    }

    public void setExportFilter(JsonNode exportFilter) {
        this.exportFilter = exportFilter;
    }

    public JsonNode getExportFields() {
        return exportFields;
    }

    public void setExportFields(JsonNode exportFields) {
        this.exportFields = exportFields;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public void setTotalItems(int totalItems) {
        this.totalItems = totalItems;
    }

    public int getProcessedItems() {
        return processedItems;
    }

    public void setProcessedItems(int processedItems) {
        this.processedItems = processedItems;
    }

    public int getSuccessfulItems() {
        return successfulItems;
    }

    public void setSuccessfulItems(int successfulItems) {
        this.successfulItems = successfulItems;
    }

    public int getFailedItems() {
        return failedItems;
    }

    public void setFailedItems(int failedItems) {
        this.failedItems = failedItems;
    }

    public int getSkippedItems() {
        return skippedItems;
    }

    public void setSkippedItems(int skippedItems) {
        this.skippedItems = skippedItems;
    }

    public String getResultKey() {
        return resultKey;
    }

    public void setResultKey(String resultKey) {
        this.resultKey = resultKey;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getQueuedAt() {
        return queuedAt;
    }

    public void setQueuedAt(Instant queuedAt) {
        this.queuedAt = queuedAt;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
