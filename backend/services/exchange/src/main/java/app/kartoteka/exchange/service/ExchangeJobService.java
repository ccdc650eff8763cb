package app.kartoteka.exchange.service;

import app.kartoteka.exchange.controller.dto.CreateExportJobRequest;
import app.kartoteka.exchange.controller.dto.CreateImportJobRequest;
import app.kartoteka.exchange.controller.dto.ImportSourceRequest;
import app.kartoteka.exchange.controller.dto.JobResponse;
import app.kartoteka.exchange.controller.dto.MappingTemplateResponse;
import app.kartoteka.exchange.controller.dto.PageResponse;
import app.kartoteka.exchange.controller.dto.RowErrorResponse;
import app.kartoteka.exchange.controller.dto.ValidationResponse;
import app.kartoteka.exchange.domain.DuplicateStrategy;
import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobKind;
import app.kartoteka.exchange.domain.JobStatus;
import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.repository.ExchangeJobRepository;
import app.kartoteka.exchange.repository.JobRowErrorRepository;
import app.kartoteka.exchange.security.CallerContext;
import app.kartoteka.exchange.service.mapping.ColumnMapping;
import app.kartoteka.exchange.service.mapping.MappingResolver;
import app.kartoteka.exchange.service.validation.ValidationReport;
import app.kartoteka.exchange.storage.ObjectStorage;
import app.kartoteka.exchange.store.ExportFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class ExchangeJobService {

    private static final int MAX_PAGE_SIZE = 200;

    private final ExchangeJobRepository jobRepository;
    private final JobRowErrorRepository rowErrorRepository;
    private final JobRegistry jobRegistry;
    private final ImportProcessor importProcessor;
    private final MappingResolver mappingResolver;
    private final MappingTemplateService templateService;
    private final ExportFieldRegistry fieldRegistry;
    private final ObjectStorage storage;
    private final ObjectMapper objectMapper;
    private final String defaultKeyField;

    public ExchangeJobService(ExchangeJobRepository jobRepository,
                              JobRowErrorRepository rowErrorRepository,
                              JobRegistry jobRegistry,
                              ImportProcessor importProcessor,
                              MappingResolver mappingResolver,
                              MappingTemplateService templateService,
                              ExportFieldRegistry fieldRegistry,
                              ObjectStorage storage,
                              ObjectMapper objectMapper,
                              @Value("${app.exchange.import.default-key-field:nip}") String defaultKeyField) {
        this.jobRepository = jobRepository;
        this.rowErrorRepository = rowErrorRepository;
        this.jobRegistry = jobRegistry;
        this.importProcessor = importProcessor;
        this.mappingResolver = mappingResolver;
        this.templateService = templateService;
        this.fieldRegistry = fieldRegistry;
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.defaultKeyField = defaultKeyField;
    }

    /**
     * Dry run: stores a job in {@code VALIDATING} with its row errors, writes no client record.
     * The job id can later be passed to {@link #createImportJob} to run it.
     */
    public ValidationResponse validateImport(CallerContext caller, ImportSourceRequest request) {
        ExchangeJobEntity job = newImportJob(caller, request);
        job.setDuplicateStrategy(DuplicateStrategy.SKIP);
        job = jobRepository.save(job);
        ValidationReport report = importProcessor.validate(job);
        if (report == null) {
            throw new JobStateException(job.getJobId(), JobStatus.CANCELLED, "validated");
        }
        return new ValidationResponse(job.getJobId(), report);
    }

    @Transactional
    public JobResponse createImportJob(CallerContext caller, CreateImportJobRequest request) {
        DuplicateStrategy strategy = request.duplicateStrategy() == null ? DuplicateStrategy.SKIP : request.duplicateStrategy();
        if (request.validationJobId() != null) {
            ExchangeJobEntity validated = requireJob(caller, request.validationJobId());
            if (validated.getJobKind() != JobKind.IMPORT || validated.getStatus() != JobStatus.VALIDATING) {
                throw new JobStateException(validated.getJobId(), validated.getStatus(), "started");
            }
            int queued = jobRepository.enqueueValidated(validated.getJobId(), strategy, request.failOnValidationErrors(), Instant.now());
            if (queued == 0) {
                throw new JobStateException(validated.getJobId(), validated.getStatus(), "started again");
            }
            return toResponse(requireJob(caller, validated.getJobId()));
        }
        if (request.source() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Either validationJobId or source is required");
        }
        ExchangeJobEntity job = newImportJob(caller, request.source());
        job.setDuplicateStrategy(strategy);
        job.setFailOnValidation(request.failOnValidationErrors());
        job.setQueuedAt(job.getCreatedAt());
        return toResponse(jobRepository.save(job));
    }

    @Transactional
    public JobResponse createExportJob(CallerContext caller, CreateExportJobRequest request) {
        if (!ExportProcessor.isSupported(request.format())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported export format: " + request.format());
        }
        ExportFilter filter = request.filter() == null ? ExportFilter.empty() : request.filter();
        List<String> fields = request.fields() == null || request.fields().isEmpty()
                ? fieldRegistry.defaultFields()
                : request.fields();
        fieldRegistry.resolve(fields);
        ExportProcessor.sortOf(filter);

        ExchangeJobEntity job = new ExchangeJobEntity();
        job.setJobId(UUID.randomUUID());
        job.setTenantId(caller.tenantId());
        job.setOwnerId(caller.userId());
        job.setJobKind(JobKind.EXPORT);
        job.setStatus(JobStatus.PENDING);
        job.setSourceFormat(request.format());
        job.setHeaderRows(1);
        job.setExportFilter(objectMapper.valueToTree(filter));
        job.setExportFields(objectMapper.valueToTree(fields));
        Instant now = Instant.now();
        job.setQueuedAt(now);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return toResponse(jobRepository.save(job));
    }

    @Transactional(readOnly = true)
    public JobResponse getJob(CallerContext caller, UUID jobId) {
        return toResponse(requireJob(caller, jobId));
    }

    @Transactional(readOnly = true)
    public PageResponse<JobResponse> listJobs(CallerContext caller, int page, int size) {
        return PageResponse.of(
                jobRepository.findByTenantIdOrderByCreatedAtDesc(caller.tenantId(), pageRequest(page, size)),
                this::toResponse
        );
    }

    @Transactional(readOnly = true)
    public PageResponse<RowErrorResponse> getErrors(CallerContext caller, UUID jobId, int page, int size) {
        requireJob(caller, jobId);
        return PageResponse.of(
                rowErrorRepository.findByJobIdOrderByRowNumberAsc(jobId, pageRequest(page, size)),
                error -> new RowErrorResponse(
                        error.getRowNumber(),
                        error.getFieldName(),
                        error.getErrorKind(),
                        error.getMessage(),
                        error.getRawValue()
                )
        );
    }

    public JobResponse cancel(CallerContext caller, UUID jobId) {
        return toResponse(jobRegistry.cancel(caller.tenantId(), jobId));
    }

    @Transactional(readOnly = true)
    public JobArtifact getArtifact(CallerContext caller, UUID jobId) {
        ExchangeJobEntity job = requireJob(caller, jobId);
        if (job.getJobKind() != JobKind.EXPORT || job.getStatus() != JobStatus.COMPLETED || job.getResultKey() == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job has no artifact");
        }
        SourceFormat format = job.getSourceFormat();
        return new JobArtifact(
                "clients-export-" + job.getJobId() + "." + format.extension(),
                format.contentType(),
                storage.get(job.getResultKey())
        );
    }

    private ExchangeJobEntity newImportJob(CallerContext caller, ImportSourceRequest request) {
        String uploadPrefix = "uploads/" + caller.tenantId() + "/";
        if (request.sourceKey() == null || !request.sourceKey().startsWith(uploadPrefix)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown source file");
        }

        ColumnMapping mapping = request.mapping() == null ? ColumnMapping.empty() : request.mapping();
        String keyField = request.duplicateKeyField();
        if (request.mappingTemplateId() != null) {
            MappingTemplateResponse template = templateService.find(caller.tenantId(), request.mappingTemplateId());
            mapping = template.mapping().overriddenBy(mapping);
            if (keyField == null || keyField.isBlank()) {
                keyField = template.duplicateKeyField();
            }
        }
        mappingResolver.resolve(mapping);
        keyField = MappingTemplateService.normalizeKeyField(keyField == null || keyField.isBlank() ? defaultKeyField : keyField);

        ExchangeJobEntity job = new ExchangeJobEntity();
        job.setJobId(UUID.randomUUID());
        job.setTenantId(caller.tenantId());
        job.setOwnerId(caller.userId());
        job.setJobKind(JobKind.IMPORT);
        job.setStatus(JobStatus.PENDING);
        job.setSourceName(normalizeOptional(request.fileName()));
        job.setSourceFormat(request.format());
        job.setSourceSizeBytes(request.sizeBytes());
        job.setSourceKey(request.sourceKey());
        job.setSourceEncoding(normalizeOptional(request.encoding()));
        job.setHeaderRows(request.headerRows() == null ? 1 : request.headerRows());
        job.setFieldMapping(objectMapper.valueToTree(mapping));
        job.setDuplicateKeyField(keyField);
        job.setTotalItems(importProcessor.countRows(job));
        Instant now = Instant.now();
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return job;
    }

    private ExchangeJobEntity requireJob(CallerContext caller, UUID jobId) {
        return jobRepository.findByJobIdAndTenantId(jobId, caller.tenantId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found"));
    }

    private PageRequest pageRequest(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    }

    private String normalizeOptional(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private JobResponse toResponse(ExchangeJobEntity job) {
        Instant reference = job.getCompletedAt() != null ? job.getCompletedAt() : Instant.now();
        JobProgress progress = JobProgress.of(job.getTotalItems(), job.getProcessedItems(), job.getStartedAt(), reference);
        return new JobResponse(
                job.getJobId(),
                job.getJobKind(),
                job.getStatus(),
                job.getSourceName(),
                job.getTotalItems(),
                job.getProcessedItems(),
                job.getSuccessfulItems(),
                job.getFailedItems(),
                job.getSkippedItems(),
                progress.percent(),
                rowErrorRepository.countByJobId(job.getJobId()),
                job.getResultKey(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getStatus().isTerminal() ? null : progress.estimatedSecondsRemaining(),
                job.getErrorMessage(),
                job.getCreatedAt()
        );
    }
}
