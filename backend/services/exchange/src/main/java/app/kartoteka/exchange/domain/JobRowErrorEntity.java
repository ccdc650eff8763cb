package app.kartoteka.exchange.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "job_row_errors", schema = "app_exchange")
public class JobRowErrorEntity {

    @Id
    @Column(name = "row_error_id", nullable = false)
    private UUID rowErrorId;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "row_number", nullable = false)
    private int rowNumber;

    @Column(name = "field_name")
    private String fieldName;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", nullable = false)
    private RowErrorKind errorKind;

    @Column(name = "message", nullable = false)
    private String message;

    @Column(name = "raw_value")
    private String rawValue;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public JobRowErrorEntity() {
    }

    public JobRowErrorEntity(UUID jobId,
                             int rowNumber,
                             String fieldName,
                             RowErrorKind errorKind,
                             String message,
                             String rawValue,
                             Instant createdAt) {
        this.rowErrorId = UUID.randomUUID();
        this.jobId = jobId;
        this.rowNumber = rowNumber;
        this.fieldName = fieldName;
        this.errorKind = errorKind;
        this.message = message;
        this.rawValue = rawValue;
        this.createdAt = createdAt;
    }

    public UUID getRowErrorId() {
        return rowErrorId;
    }

    public void setRowErrorId(UUID rowErrorId) {
        this.rowErrorId = rowErrorId;
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public void setRowNumber(int rowNumber) {
        this.rowNumber = rowNumber;
    }

    public String getFieldName() {
        return fieldName;
    }

    public void setFieldName(String fieldName) {
        this.fieldName = fieldName;
    }

    public RowErrorKind getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(RowErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getRawValue() {
        return rawValue;
    }

    public void setRawValue(String rawValue) {
        this.rawValue = rawValue;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
