package app.kartoteka.exchange.service;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientStatus;
import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobKind;
import app.kartoteka.exchange.domain.JobStatus;
import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.store.ExportFilter;
import app.kartoteka.exchange.store.InMemoryClientStore;
import app.kartoteka.exchange.storage.ObjectStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Sort;
import org.springframework.web.server.ResponseStatusException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExportProcessorTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final UUID tenantId = UUID.randomUUID();

    private InMemoryClientStore clientStore;
    private ObjectStorage storage;
    private JobRegistry jobRegistry;
    private ExportProcessor processor;

    @BeforeEach
    void setUp() {
        clientStore = new InMemoryClientStore();
        storage = mock(ObjectStorage.class);
        jobRegistry = mock(JobRegistry.class);
        when(jobRegistry.moveTo(any(ExchangeJobEntity.class), any(JobStatus.class))).thenReturn(true);
        processor = new ExportProcessor(
                clientStore,
                storage,
                new ExportFieldRegistry("displayName,nip,tags"),
                jobRegistry,
                objectMapper,
                2
        );
        clientStore.seed(tenantId, client -> {
            client.setCompanyName("Beta, \"Quoted\" S.A.");
            client.setNip("1234563218");
            client.setTags(List.of("vip", "b2b"));
        });
        clientStore.seed(tenantId, client -> {
            client.setCompanyName("Acme");
            client.setNip("5270103391");
        });
        clientStore.seed(tenantId, client -> {
            client.setCompanyName("Gamma");
            client.setStatus(ClientStatus.ARCHIVED);
        });
        clientStore.seed(UUID.randomUUID(), client -> client.setCompanyName("Other tenant"));
    }

    @Test
    void writesCsvWithBomHeaderAndQuoting() {
        ExchangeJobEntity job = job(SourceFormat.CSV, ExportFilter.empty(), List.of());

        processor.process(job);

        String csv = new String(storedArtifact(job, SourceFormat.CSV), StandardCharsets.UTF_8);
        assertTrue(csv.startsWith("\uFEFF"));
        List<String> lines = List.of(csv.substring(1).split("\r\n"));
        assertEquals("displayName,nip,tags", lines.get(0));
        assertEquals("Acme,5270103391,", lines.get(1));
        assertEquals("\"Beta, \"\"Quoted\"\" S.A.\",1234563218,vip;b2b", lines.get(2));
        assertEquals("Gamma,,", lines.get(3));
        assertEquals(4, lines.size());
        verify(jobRegistry).recordResult(job.getJobId(), ExportProcessor.artifactKey(tenantId, job.getJobId(), SourceFormat.CSV));
        verify(jobRegistry).moveTo(job, JobStatus.COMPLETED);
    }

    @Test
    void appliesFilterAndRequestedFields() {
        ExportFilter filter = new ExportFilter(List.of(ClientStatus.ARCHIVED), null, null, null, null, null, null, null);
        ExchangeJobEntity job = job(SourceFormat.SEMICOLON_CSV, filter, List.of("displayName", "status"));

        processor.process(job);

        String csv = new String(storedArtifact(job, SourceFormat.SEMICOLON_CSV), StandardCharsets.UTF_8);
        assertEquals("displayName;status\r\nGamma;ARCHIVED\r\n", csv.substring(1));
    }

    @Test
    void writesXlsxWorkbook() throws IOException {
        ExchangeJobEntity job = job(SourceFormat.XLSX, ExportFilter.empty(), List.of("displayName", "customFields.segment"));

        processor.process(job);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(storedArtifact(job, SourceFormat.XLSX)))) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("displayName", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("customFields.segment", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals("Acme", sheet.getRow(1).getCell(0).getStringCellValue());
            assertEquals(3, sheet.getLastRowNum());
        }
    }

    @Test
    void reportsProgressPerPage() {
        ExchangeJobEntity job = job(SourceFormat.CSV, ExportFilter.empty(), List.of());

        processor.process(job);

        ArgumentCaptor<JobCounters> captor = ArgumentCaptor.forClass(JobCounters.class);
        verify(jobRegistry, times(2)).recordProgress(eq(job.getJobId()), captor.capture());
        JobCounters counters = captor.getValue();
        assertEquals(3, counters.total());
        assertEquals(3, counters.successful());
    }

    @Test
    void deletingAnExportedRecordDoesNotDropLaterOnes() {
        clientStore.afterNextRead(() -> softDelete("Acme"));
        ExchangeJobEntity job = job(SourceFormat.CSV, ExportFilter.empty(), List.of("displayName"));

        processor.process(job);

        String csv = new String(storedArtifact(job, SourceFormat.CSV), StandardCharsets.UTF_8);
        assertEquals("displayName\r\nAcme\r\n\"Beta, \"\"Quoted\"\" S.A.\"\r\nGamma\r\n", csv.substring(1));
        JobCounters counters = lastCounters(job);
        assertEquals(3, counters.total());
        assertEquals(3, counters.processed());
        assertEquals(3, counters.successful());
    }

    @Test
    void recordDeletedBeforeItsChunkLowersTotal() {
        clientStore.afterNextRead(() -> softDelete("Gamma"));
        ExchangeJobEntity job = job(SourceFormat.CSV, ExportFilter.empty(), List.of("displayName"));

        processor.process(job);

        String csv = new String(storedArtifact(job, SourceFormat.CSV), StandardCharsets.UTF_8);
        assertEquals("displayName\r\nAcme\r\n\"Beta, \"\"Quoted\"\" S.A.\"\r\n", csv.substring(1));
        JobCounters counters = lastCounters(job);
        assertEquals(2, counters.total());
        assertEquals(2, counters.processed());
        assertEquals(2, counters.successful());
        verify(jobRegistry).moveTo(job, JobStatus.COMPLETED);
    }

    @Test
    void stopsWithoutArtifactWhenCancelled() {
        ExchangeJobEntity job = job(SourceFormat.CSV, ExportFilter.empty(), List.of());
        when(jobRegistry.isCancelled(job.getJobId())).thenReturn(false, true);

        processor.process(job);

        verify(storage, never()).put(anyString(), anyString(), any());
        verify(jobRegistry, never()).moveTo(job, JobStatus.COMPLETED);
    }

    @Test
    void sortsByRequestedFieldWithIdTieBreaker() {
        Sort sort = ExportProcessor.sortOf(new ExportFilter(null, null, null, null, null, Map.of(), "createdAt", "DESC"));

        assertEquals(Sort.Direction.DESC, sort.getOrderFor("createdAt").getDirection());
        assertEquals(Sort.Direction.ASC, sort.getOrderFor("clientId").getDirection());
        assertThrows(ResponseStatusException.class,
                () -> ExportProcessor.sortOf(new ExportFilter(null, null, null, null, null, null, "nip", null)));
    }

    private void softDelete(String displayName) {
        ClientEntity client = clientStore.all(tenantId).stream()
                .filter(candidate -> displayName.equals(candidate.getDisplayName()))
                .findFirst()
                .orElseThrow();
        clientStore.update(tenantId, client.getClientId(), null, deleted -> deleted.setDeletedAt(Instant.now()));
    }

    private JobCounters lastCounters(ExchangeJobEntity job) {
        ArgumentCaptor<JobCounters> captor = ArgumentCaptor.forClass(JobCounters.class);
        verify(jobRegistry, atLeastOnce()).recordProgress(eq(job.getJobId()), captor.capture());
        return captor.getValue();
    }

    private byte[] storedArtifact(ExchangeJobEntity job, SourceFormat format) {
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(storage).put(eq(ExportProcessor.artifactKey(tenantId, job.getJobId(), format)), eq(format.contentType()), captor.capture());
        return captor.getValue();
    }

    private ExchangeJobEntity job(SourceFormat format, ExportFilter filter, List<String> fields) {
        ExchangeJobEntity job = new ExchangeJobEntity();
        job.setJobId(UUID.randomUUID());
        job.setTenantId(tenantId);
        job.setOwnerId(UUID.randomUUID());
        job.setJobKind(JobKind.EXPORT);
        job.setStatus(JobStatus.PENDING);
        job.setSourceFormat(format);
        job.setExportFilter(objectMapper.valueToTree(filter));
        job.setExportFields(objectMapper.valueToTree(fields));
        return job;
    }
}
