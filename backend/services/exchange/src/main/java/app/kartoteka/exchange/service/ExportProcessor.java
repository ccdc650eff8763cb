package app.kartoteka.exchange.service;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ExchangeJobEntity;
import app.kartoteka.exchange.domain.JobStatus;
import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.service.ExportFieldRegistry.ExportColumn;
import app.kartoteka.exchange.storage.ObjectStorage;
import app.kartoteka.exchange.store.ClientStore;
import app.kartoteka.exchange.store.ExportFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
public class ExportProcessor {

    private static final Logger log = LoggerFactory.getLogger(ExportProcessor.class);
    private static final Set<String> SORTABLE = Set.of("displayName", "createdAt", "updatedAt", "email");
    private static final Set<SourceFormat> FORMATS = Set.of(SourceFormat.CSV, SourceFormat.SEMICOLON_CSV, SourceFormat.XLSX);

    private final ClientStore clientStore;
    private final ObjectStorage storage;
    private final ExportFieldRegistry fieldRegistry;
    private final JobRegistry jobRegistry;
    private final ObjectMapper objectMapper;
    private final int pageSize;

    public ExportProcessor(ClientStore clientStore,
                           ObjectStorage storage,
                           ExportFieldRegistry fieldRegistry,
                           JobRegistry jobRegistry,
                           ObjectMapper objectMapper,
                           @Value("${app.exchange.export.page-size:500}") int pageSize) {
        this.clientStore = clientStore;
        this.storage = storage;
        this.fieldRegistry = fieldRegistry;
        this.jobRegistry = jobRegistry;
        this.objectMapper = objectMapper;
        this.pageSize = Math.max(pageSize, 1);
    }

    public static boolean isSupported(SourceFormat format) {
        return FORMATS.contains(format);
    }

    public static String artifactKey(UUID tenantId, UUID jobId, SourceFormat format) {
        return "exports/" + tenantId + "/" + jobId + "." + format.extension();
    }

    public void process(ExchangeJobEntity job) {
        SourceFormat format = job.getSourceFormat() == null ? SourceFormat.CSV : job.getSourceFormat();
        if (!isSupported(format)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported export format: " + format);
        }
        if (!jobRegistry.moveTo(job, JobStatus.PROCESSING)) {
            log.info("Export job stopped before processing jobId={}", job.getJobId());
            return;
        }
        ExportFilter filter = readFilter(job);
        List<ExportColumn> columns = fieldRegistry.resolve(readFields(job.getExportFields()));
        Sort sort = sortOf(filter);

        // the selection is fixed up front so concurrent writes cannot shift records between chunks
        List<UUID> ids = clientStore.findIdsByFilter(job.getTenantId(), filter, sort);
        JobCounters counters = new JobCounters(ids.size());
        try (RowSink sink = format == SourceFormat.XLSX ? new XlsxSink() : new CsvSink(format.delimiter())) {
            sink.header(columns.stream().map(ExportColumn::name).toList());
            int from = 0;
            do {
                if (jobRegistry.isCancelled(job.getJobId())) {
                    log.info("Export job cancelled jobId={} processed={} total={}", job.getJobId(), counters.processed(), counters.total());
                    return;
                }
                List<UUID> chunk = ids.subList(from, Math.min(from + pageSize, ids.size()));
                Map<UUID, ClientEntity> live = new HashMap<>();
                for (ClientEntity client : clientStore.findAllByIds(job.getTenantId(), chunk)) {
                    live.put(client.getClientId(), client);
                }
                for (UUID clientId : chunk) {
                    ClientEntity client = live.get(clientId);
                    if (client == null) {
                        // deleted after the selection was read
                        continue;
                    }
                    List<String> values = new ArrayList<>(columns.size());
                    for (ExportColumn column : columns) {
                        values.add(column.extract(client));
                    }
                    sink.row(values);
                    counters.success();
                }
                from += pageSize;
                if (from >= ids.size()) {
                    counters.settleTotal();
                }
                jobRegistry.recordProgress(job.getJobId(), counters);
            } while (from < ids.size());

            String key = artifactKey(job.getTenantId(), job.getJobId(), format);
            storage.put(key, format.contentType(), sink.finish());
            jobRegistry.recordResult(job.getJobId(), key);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write export artifact", ex);
        }
        jobRegistry.moveTo(job, JobStatus.COMPLETED);
        log.info("Export job finished jobId={} format={} records={}", job.getJobId(), format, counters.processed());
    }

    private ExportFilter readFilter(ExchangeJobEntity job) {
        JsonNode node = job.getExportFilter();
        if (node == null || node.isNull()) {
            return ExportFilter.empty();
        }
        try {
            return objectMapper.treeToValue(node, ExportFilter.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored export filter is not readable for job " + job.getJobId(), ex);
        }
    }

    private List<String> readFields(JsonNode node) {
        List<String> fields = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> fields.add(item.asText()));
        }
        return fields;
    }

    static Sort sortOf(ExportFilter filter) {
        String property = filter.sortBy() == null || filter.sortBy().isBlank() ? "displayName" : filter.sortBy().trim();
        if (!SORTABLE.contains(property)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported sort field: " + property);
        }
        Sort.Direction direction = filter.sortDirection() != null
                && filter.sortDirection().trim().toLowerCase(Locale.ROOT).equals("desc")
                ? Sort.Direction.DESC
                : Sort.Direction.ASC;
        // id keeps page boundaries stable when sort values repeat
        return Sort.by(direction, property).and(Sort.by(Sort.Direction.ASC, "clientId"));
    }

    private interface RowSink extends AutoCloseable {
        void header(List<String> names) throws IOException;

        void row(List<String> values) throws IOException;

        byte[] finish() throws IOException;

        @Override
        void close() throws IOException;
    }

    private static final class CsvSink implements RowSink {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Writer writer;
        private final CSVPrinter printer;

        CsvSink(char delimiter) throws IOException {
            this.writer = new OutputStreamWriter(buffer, StandardCharsets.UTF_8);
            writer.write('\uFEFF');
            CSVFormat format = CSVFormat.DEFAULT.builder()
                    .setDelimiter(delimiter)
                    .setQuoteMode(QuoteMode.MINIMAL)
                    .setRecordSeparator("\r\n")
                    .build();
            this.printer = new CSVPrinter(writer, format);
        }

        @Override
        public void header(List<String> names) throws IOException {
            printer.printRecord(names);
        }

        @Override
        public void row(List<String> values) throws IOException {
            printer.printRecord(values);
        }

        @Override
        public byte[] finish() throws IOException {
            printer.flush();
            return buffer.toByteArray();
        }

        @Override
        public void close() throws IOException {
            printer.close();
        }
    }

    private static final class XlsxSink implements RowSink {
        private final Workbook workbook = new XSSFWorkbook();
        private final Sheet sheet = workbook.createSheet("clients");
        private int rowIndex;

        @Override
        public void header(List<String> names) {
            Font bold = workbook.createFont();
            bold.setBold(true);
            CellStyle style = workbook.createCellStyle();
            style.setFont(bold);
            Row row = sheet.createRow(rowIndex++);
            for (int i = 0; i < names.size(); i++) {
                var cell = row.createCell(i);
                cell.setCellValue(names.get(i));
                cell.setCellStyle(style);
            }
        }

        @Override
        public void row(List<String> values) {
            Row row = sheet.createRow(rowIndex++);
            for (int i = 0; i < values.size(); i++) {
                row.createCell(i).setCellValue(values.get(i));
            }
        }

        @Override
        public byte[] finish() throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        }

        @Override
        public void close() throws IOException {
            workbook.close();
        }
    }
}
