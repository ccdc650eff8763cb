package app.kartoteka.exchange.service;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.DuplicateStrategy;
import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobKind;
import app.kartoteka.exchange.domain.JobStatus;
import app.kartoteka.exchange.domain.RowErrorKind;
import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.service.mapping.ColumnMapping;
import app.kartoteka.exchange.service.mapping.FieldMapping;
import app.kartoteka.exchange.service.mapping.MappingResolver;
import app.kartoteka.exchange.service.parser.ImportParseException;
import app.kartoteka.exchange.service.parser.ImportParserFactory;
import app.kartoteka.exchange.service.validation.ImportValidator;
import app.kartoteka.exchange.service.validation.RowIssue;
import app.kartoteka.exchange.service.validation.ValidationReport;
import app.kartoteka.exchange.storage.ObjectStorage;
import app.kartoteka.exchange.store.InMemoryClientStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImportProcessorTest {

    private static final String SOURCE_KEY = "uploads/tenant/source.csv";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UUID tenantId = UUID.randomUUID();

    private ObjectStorage storage;
    private JobRegistry jobRegistry;
    private InMemoryClientStore clientStore;
    private ImportProcessor processor;

    @BeforeEach
    void setUp() {
        storage = mock(ObjectStorage.class);
        jobRegistry = mock(JobRegistry.class);
        clientStore = new InMemoryClientStore();
        when(jobRegistry.moveTo(any(ExchangeJobEntity.class), any(JobStatus.class))).thenAnswer(invocation -> {
            ExchangeJobEntity job = invocation.getArgument(0);
            job.setStatus(invocation.getArgument(1));
            return true;
        });
        processor = new ImportProcessor(
                storage,
                new ImportParserFactory(),
                new MappingResolver(),
                new ImportValidator(),
                clientStore,
                jobRegistry,
                objectMapper,
                2,
                100
        );
    }

    @Test
    void importsValidRowsAndCountsEveryRow() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, """
                firma,nip,email
                Acme,5270103391,biuro@acme.pl
                Beta,1234563218,
                ,5213017228,kontakt@gamma.pl
                """);

        processor.process(job);

        List<ClientEntity> clients = clientStore.all(tenantId);
        assertEquals(2, clients.size());
        assertEquals("Acme", clients.get(0).getDisplayName());
        assertEquals("biuro@acme.pl", clients.get(0).getEmail());

        JobCounters last = lastCounters();
        assertEquals(3, last.total());
        assertEquals(3, last.processed());
        assertEquals(2, last.successful());
        assertEquals(1, last.failed());
        assertEquals(0, last.skipped());
        assertEquals(JobStatus.COMPLETED, job.getStatus());
    }

    @Test
    void skipsRowsWhoseKeyAlreadyExists() {
        clientStore.seed(tenantId, client -> {
            client.setCompanyName("Acme (old)");
            client.setNip("5270103391");
        });
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, """
                firma,nip,email
                Acme,5270103391,biuro@acme.pl
                Beta,1234563218,
                """);

        processor.process(job);

        assertEquals(2, clientStore.all(tenantId).size());
        assertEquals("Acme (old)", clientStore.all(tenantId).get(0).getCompanyName());
        JobCounters last = lastCounters();
        assertEquals(1, last.skipped());
        assertEquals(1, last.successful());
    }

    @Test
    void rerunningSameFileWithSkipWritesNothing() {
        String csv = """
                firma,nip,email
                Acme,5270103391,biuro@acme.pl
                Beta,1234563218,
                """;
        processor.process(job(DuplicateStrategy.SKIP, csv));
        int writesAfterFirstRun = clientStore.writes();

        ExchangeJobEntity rerun = job(DuplicateStrategy.SKIP, csv);
        processor.process(rerun);

        assertEquals(writesAfterFirstRun, clientStore.writes());
        assertEquals(2, clientStore.all(tenantId).size());
        assertEquals(2, lastCounters().skipped());
        assertEquals(JobStatus.COMPLETED, rerun.getStatus());
    }

    @Test
    void updatesExistingRecordWithNonEmptyValues() {
        ClientEntity existing = clientStore.seed(tenantId, client -> {
            client.setCompanyName("Acme (old)");
            client.setNip("5270103391");
            client.setEmail("old@acme.pl");
            client.setCity("Gdańsk");
        });
        ExchangeJobEntity job = job(DuplicateStrategy.UPDATE, """
                firma,nip,email
                Acme,5270103391,
                """);

        processor.process(job);

        assertEquals(1, clientStore.all(tenantId).size());
        assertEquals("Acme", existing.getCompanyName());
        assertEquals("old@acme.pl", existing.getEmail());
        assertEquals("Gdańsk", existing.getCity());
        assertEquals(1L, existing.getVersion());
        assertEquals(1, lastCounters().successful());
    }

    @Test
    void updateCreatesNewRowsAndUpdatesTheMatchingOne() {
        ClientEntity existing = clientStore.seed(tenantId, client -> {
            client.setCompanyName("Beta (old)");
            client.setNip("1234563218");
        });
        ExchangeJobEntity job = job(DuplicateStrategy.UPDATE, """
                firma,nip,email
                Acme,5270103391,biuro@acme.pl
                Beta,1234563218,kontakt@beta.pl
                Gamma,5213017228,
                """);

        processor.process(job);

        assertEquals(3, clientStore.all(tenantId).size());
        assertEquals("Beta", existing.getCompanyName());
        assertEquals("kontakt@beta.pl", existing.getEmail());
        JobCounters last = lastCounters();
        assertEquals(3, last.processed());
        assertEquals(3, last.successful());
        assertEquals(0, last.failed());
        assertEquals(0, last.skipped());
        assertEquals(JobStatus.COMPLETED, job.getStatus());
    }

    @Test
    void createNewKeepsDuplicates() {
        clientStore.seed(tenantId, client -> {
            client.setCompanyName("Acme");
            client.setNip("5270103391");
        });
        ExchangeJobEntity job = job(DuplicateStrategy.CREATE_NEW, """
                firma,nip,email
                Acme,5270103391,
                Acme,5270103391,
                """);

        processor.process(job);

        assertEquals(3, clientStore.all(tenantId).size());
        assertEquals(2, lastCounters().successful());
    }

    @Test
    void secondRowWithSameKeyIsSkippedWithinOneFile() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, """
                firma,nip,email
                Acme,5270103391,
                Acme again,5270103391,
                """);

        processor.process(job);

        assertEquals(1, clientStore.all(tenantId).size());
        assertEquals(1, lastCounters().skipped());
    }

    @Test
    void failsJobWithoutWritesWhenValidationMustPass() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, """
                firma,nip,email
                Acme,5270103391,
                Beta,123,
                """);
        job.setFailOnValidation(true);

        processor.process(job);

        assertEquals(0, clientStore.writes());
        verify(jobRegistry).fail(eq(job), anyString());
        verify(jobRegistry, never()).moveTo(job, JobStatus.PROCESSING);
    }

    @Test
    void recordsRowErrorsFromValidation() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, """
                firma,nip,email
                Acme,5270103391,not-an-email
                """);

        processor.process(job);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RowIssue>> captor = ArgumentCaptor.forClass(List.class);
        verify(jobRegistry, atLeastOnce()).recordRowErrors(eq(job.getJobId()), captor.capture());
        RowIssue issue = captor.getAllValues().get(0).get(0);
        assertEquals(2, issue.rowNumber());
        assertEquals("email", issue.fieldName());
        assertEquals(RowErrorKind.INVALID_FORMAT, issue.kind());
        verify(jobRegistry).clearRowErrors(job.getJobId());
    }

    @Test
    void stopsBetweenBatchesWhenCancelled() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, """
                firma,nip,email
                A,,
                B,,
                C,,
                D,,
                """);
        when(jobRegistry.isCancelled(job.getJobId())).thenReturn(false, false, true);

        processor.process(job);

        assertEquals(2, clientStore.all(tenantId).size());
        verify(jobRegistry, never()).moveTo(job, JobStatus.COMPLETED);
    }

    @Test
    void doesNothingWhenCancelledBeforeValidation() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, "firma,nip,email\nA,,\n");
        doReturn(false).when(jobRegistry).moveTo(job, JobStatus.VALIDATING);

        processor.process(job);

        assertEquals(0, clientStore.writes());
        verify(storage, never()).get(anyString());
    }

    @Test
    void validateOnlyWritesNothing() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, """
                firma,nip,email
                Acme,5270103391,
                Acme,5270103391,
                """);

        ValidationReport report = processor.validate(job);

        assertEquals(2, report.totalRecords());
        assertEquals(1, report.duplicates().size());
        assertEquals(0, clientStore.writes());
        assertEquals(JobStatus.VALIDATING, job.getStatus());
        verify(jobRegistry, never()).moveTo(job, JobStatus.PROCESSING);
    }

    @Test
    void validateReturnsNullForCancelledJob() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, "firma,nip,email\nA,,\n");
        doReturn(false).when(jobRegistry).moveTo(job, JobStatus.VALIDATING);

        assertNull(processor.validate(job));
    }

    @Test
    void unreadableFilePropagatesAsParseError() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, "");

        assertThrows(ImportParseException.class, () -> processor.process(job));
        assertEquals(0, clientStore.writes());
    }

    @Test
    void countsRowsOfSource() {
        ExchangeJobEntity job = job(DuplicateStrategy.SKIP, "firma,nip,email\nA,,\n\nB,,\n");

        assertEquals(2, processor.countRows(job));
    }

    private JobCounters lastCounters() {
        ArgumentCaptor<JobCounters> captor = ArgumentCaptor.forClass(JobCounters.class);
        verify(jobRegistry, atLeastOnce()).recordProgress(any(UUID.class), captor.capture());
        List<JobCounters> values = new ArrayList<>(captor.getAllValues());
        return values.get(values.size() - 1);
    }

    private ExchangeJobEntity job(DuplicateStrategy strategy, String csv) {
        ExchangeJobEntity job = new ExchangeJobEntity();
        job.setJobId(UUID.randomUUID());
        job.setTenantId(tenantId);
        job.setOwnerId(UUID.randomUUID());
        job.setJobKind(JobKind.IMPORT);
        job.setStatus(JobStatus.PENDING);
        job.setSourceFormat(SourceFormat.CSV);
        job.setSourceKey(SOURCE_KEY);
        job.setHeaderRows(1);
        job.setDuplicateStrategy(strategy);
        job.setDuplicateKeyField("nip");
        job.setFieldMapping(objectMapper.valueToTree(new ColumnMapping(List.of(
                new FieldMapping("firma", "companyName", null, null, true),
                new FieldMapping("nip", "nip", null, null, false),
                new FieldMapping("email", "email", null, null, false)
        ))));
        job.setCreatedAt(Instant.now());
        when(storage.get(SOURCE_KEY)).thenReturn(csv.getBytes(StandardCharsets.UTF_8));
        return job;
    }
}
