package app.kartoteka.exchange.service;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.DuplicateStrategy;
import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobStatus;
import app.kartoteka.exchange.domain.RowErrorKind;
import app.kartoteka.exchange.service.mapping.ColumnMapping;
import app.kartoteka.exchange.service.mapping.MappingResolver;
import app.kartoteka.exchange.service.mapping.ResolvedMapping;
import app.kartoteka.exchange.service.mapping.ResolvedRecord;
import app.kartoteka.exchange.service.mapping.TargetField;
import app.kartoteka.exchange.service.parser.ImportParseException;
import app.kartoteka.exchange.service.parser.ImportParser;
import app.kartoteka.exchange.service.parser.ImportParserFactory;
import app.kartoteka.exchange.service.parser.ImportStream;
import app.kartoteka.exchange.service.parser.ParseOptions;
import app.kartoteka.exchange.service.validation.ImportValidator;
import app.kartoteka.exchange.service.validation.RowIssue;
import app.kartoteka.exchange.service.validation.ValidationReport;
import app.kartoteka.exchange.storage.ObjectStorage;
import app.kartoteka.exchange.store.ClientStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class ImportProcessor {

    private static final Logger log = LoggerFactory.getLogger(ImportProcessor.class);

    private final ObjectStorage storage;
    private final ImportParserFactory parserFactory;
    private final MappingResolver mappingResolver;
    private final ImportValidator validator;
    private final ClientStore clientStore;
    private final JobRegistry jobRegistry;
    private final ObjectMapper objectMapper;
    private final int batchSize;
    private final int maxRows;

    public ImportProcessor(ObjectStorage storage,
                           ImportParserFactory parserFactory,
                           MappingResolver mappingResolver,
                           ImportValidator validator,
                           ClientStore clientStore,
                           JobRegistry jobRegistry,
                           ObjectMapper objectMapper,
                           @Value("${app.exchange.import.batch-size:100}") int batchSize,
                           @Value("${app.exchange.import.max-rows:10000}") int maxRows) {
        this.storage = storage;
        this.parserFactory = parserFactory;
        this.mappingResolver = mappingResolver;
        this.validator = validator;
        this.clientStore = clientStore;
        this.jobRegistry = jobRegistry;
        this.objectMapper = objectMapper;
        this.batchSize = Math.max(batchSize, 1);
        this.maxRows = Math.max(maxRows, 0);
    }

    public int countRows(ExchangeJobEntity job) {
        ImportParser parser = parserFactory.create(job.getSourceFormat());
        try {
            return parser.countRows(new ByteArrayInputStream(storage.get(job.getSourceKey())), parseOptions(job));
        } catch (IOException ex) {
            throw new ImportParseException("Failed to read source file", ex);
        }
    }

    /**
     * Validates the job's file and stores its row errors. Leaves the job in {@code VALIDATING}.
     *
     * @return {@code null} when the job could not enter validation, because it was cancelled
     */
    public ValidationReport validate(ExchangeJobEntity job) {
        if (job.getStatus() == JobStatus.PENDING && !jobRegistry.moveTo(job, JobStatus.VALIDATING)) {
            return null;
        }
        ImportPlan plan = plan(job);
        return validate(job, plan, loadKeyIndex(job, plan));
    }

    public void process(ExchangeJobEntity job) {
        if (job.getStatus() == JobStatus.PENDING && !jobRegistry.moveTo(job, JobStatus.VALIDATING)) {
            return;
        }
        ImportPlan plan = plan(job);
        Map<String, UUID> keyIndex = loadKeyIndex(job, plan);
        ValidationReport report = validate(job, plan, keyIndex);

        if (job.isFailOnValidation() && !report.isValid()) {
            jobRegistry.fail(job, "Validation failed: " + (report.totalRecords() - report.validRecords())
                    + " of " + report.totalRecords() + " rows have errors");
            return;
        }
        if (jobRegistry.isCancelled(job.getJobId()) || !jobRegistry.moveTo(job, JobStatus.PROCESSING)) {
            log.info("Import job stopped before processing jobId={}", job.getJobId());
            return;
        }

        JobCounters counters = new JobCounters(report.totalRecords());
        boolean cancelled = execute(job, plan, new HashMap<>(keyIndex), counters);
        if (cancelled) {
            log.info("Import job cancelled jobId={} processed={} total={}", job.getJobId(), counters.processed(), counters.total());
            return;
        }
        jobRegistry.moveTo(job, JobStatus.COMPLETED);
        log.info(
                "Import job finished jobId={} total={} successful={} failed={} skipped={}",
                job.getJobId(),
                counters.total(),
                counters.successful(),
                counters.failed(),
                counters.skipped()
        );
    }

    private ValidationReport validate(ExchangeJobEntity job, ImportPlan plan, Map<String, UUID> keyIndex) {
        ValidationReport report;
        try (ImportStream stream = plan.open()) {
            report = validator.validate(stream, plan.mapping(), plan.keyField(), keyIndex);
        } catch (IOException ex) {
            throw new ImportParseException("Failed to read source file", ex);
        }
        jobRegistry.clearRowErrors(job.getJobId());
        jobRegistry.recordRowErrors(job.getJobId(), report.errors());
        jobRegistry.recordProgress(job.getJobId(), new JobCounters(report.totalRecords()));
        log.info(
                "Import validated jobId={} total={} valid={} errors={} duplicates={}",
                job.getJobId(),
                report.totalRecords(),
                report.validRecords(),
                report.errors().size(),
                report.duplicates().size()
        );
        return report;
    }

    private boolean execute(ExchangeJobEntity job, ImportPlan plan, Map<String, UUID> keyIndex, JobCounters counters) {
        DuplicateStrategy strategy = job.getDuplicateStrategy() == null ? DuplicateStrategy.SKIP : job.getDuplicateStrategy();
        try (ImportStream stream = plan.open()) {
            List<ResolvedRecord> batch = new ArrayList<>(batchSize);
            while (stream.hasNext()) {
                if (jobRegistry.isCancelled(job.getJobId())) {
                    return true;
                }
                batch.clear();
                while (stream.hasNext() && batch.size() < batchSize) {
                    batch.add(plan.mapping().apply(stream.next()));
                }
                List<RowIssue> batchIssues = new ArrayList<>();
                for (ResolvedRecord record : batch) {
                    writeRow(job, plan, strategy, keyIndex, record, counters, batchIssues);
                }
                jobRegistry.recordRowErrors(job.getJobId(), batchIssues);
                jobRegistry.recordProgress(job.getJobId(), counters);
            }
        } catch (IOException ex) {
            throw new ImportParseException("Failed to read source file", ex);
        }
        return false;
    }

    private void writeRow(ExchangeJobEntity job,
                          ImportPlan plan,
                          DuplicateStrategy strategy,
                          Map<String, UUID> keyIndex,
                          ResolvedRecord record,
                          JobCounters counters,
                          List<RowIssue> issues) {
        // rejected rows already have their errors from the validation pass
        if (!validator.checkRow(record, plan.mapping()).isEmpty()) {
            counters.failure();
            return;
        }
        String key = plan.keyField() == null ? null : record.value(plan.keyField());
        UUID existingId = key == null ? null : keyIndex.get(key);
        try {
            if (existingId != null && strategy == DuplicateStrategy.SKIP) {
                counters.skip();
                return;
            }
            if (existingId != null && strategy == DuplicateStrategy.UPDATE) {
                clientStore.update(job.getTenantId(), existingId, null, record::applyTo);
                counters.success();
                return;
            }
            ClientEntity created = clientStore.create(job.getTenantId(), job.getOwnerId(), record::applyTo);
            if (key != null) {
                keyIndex.putIfAbsent(key, created.getClientId());
            }
            counters.success();
        } catch (RuntimeException ex) {
            log.warn("Import row failed jobId={} row={} error={}", job.getJobId(), record.rowNumber(), ex.getMessage());
            counters.failure();
            issues.add(new RowIssue(
                    record.rowNumber(),
                    null,
                    RowErrorKind.PROCESSING_ERROR,
                    ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(),
                    key
            ));
        }
    }

    private Map<String, UUID> loadKeyIndex(ExchangeJobEntity job, ImportPlan plan) {
        if (plan.keyField() == null || plan.keyField().isCustom()) {
            return Map.of();
        }
        return clientStore.findKeyIndex(job.getTenantId(), plan.keyField().field());
    }

    private ImportPlan plan(ExchangeJobEntity job) {
        ColumnMapping mapping;
        try {
            mapping = job.getFieldMapping() == null || job.getFieldMapping().isNull()
                    ? ColumnMapping.empty()
                    : objectMapper.treeToValue(job.getFieldMapping(), ColumnMapping.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored column mapping is not readable for job " + job.getJobId(), ex);
        }
        ResolvedMapping resolved = mappingResolver.resolve(mapping);
        TargetField keyField = job.getDuplicateKeyField() == null ? null : TargetField.parse(job.getDuplicateKeyField());
        byte[] content = storage.get(job.getSourceKey());
        return new ImportPlan(parserFactory.create(job.getSourceFormat()), parseOptions(job), resolved, keyField, content);
    }

    private ParseOptions parseOptions(ExchangeJobEntity job) {
        return new ParseOptions(job.getSourceEncoding(), Math.max(job.getHeaderRows(), 1), maxRows);
    }

    private record ImportPlan(
            ImportParser parser,
            ParseOptions options,
            ResolvedMapping mapping,
            TargetField keyField,
            byte[] content
    ) {
        ImportStream open() throws IOException {
            return parser.openStream(new ByteArrayInputStream(content), options);
        }
    }
}
