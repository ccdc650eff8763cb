package app.kartoteka.exchange.service;

import app.kartoteka.exchange.controller.dto.UploadResponse;
import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.security.CallerContext;
import app.kartoteka.exchange.storage.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

@Service
public class ImportSourceService {

    private static final Logger log = LoggerFactory.getLogger(ImportSourceService.class);
    private static final byte[] ZIP_SIGNATURE = {0x50, 0x4b, 0x03, 0x04};
    private static final int SNIFF_BYTES = 4096;

    private final ObjectStorage storage;

    public ImportSourceService(ObjectStorage storage) {
        this.storage = storage;
    }

    public UploadResponse uploadSource(CallerContext caller, MultipartFile file, SourceFormat explicitFormat) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing file");
        }
        String fileName = file.getOriginalFilename();
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Failed to read upload", ex);
        }
        String contentType = normalizeContentType(file.getContentType());
        SourceFormat format = explicitFormat != null ? explicitFormat : detectFormat(fileName, contentType, content);

        String key = "uploads/" + caller.tenantId() + "/" + UUID.randomUUID() + "/" + safeName(fileName, format);
        storage.put(key, format.contentType(), content);
        log.info("Import source uploaded tenantId={} key={} format={} sizeBytes={}", caller.tenantId(), key, format, content.length);
        return new UploadResponse(key, fileName, format, content.length);
    }

    SourceFormat detectFormat(String fileName, String contentType, byte[] content) {
        if (startsWith(content, ZIP_SIGNATURE)) {
            return SourceFormat.XLSX;
        }
        SourceFormat byName = detectFormatByName(fileName);
        if (byName != null && byName != SourceFormat.CSV) {
            return byName;
        }
        SourceFormat byContentType = detectFormatByContentType(contentType);
        if (byContentType != null && byContentType != SourceFormat.CSV) {
            return byContentType;
        }
        return sniffDelimiter(content);
    }

    private SourceFormat detectFormatByName(String fileName) {
        if (fileName == null) {
            return null;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".xlsx")) {
            return SourceFormat.XLSX;
        }
        if (lower.endsWith(".tsv") || lower.endsWith(".tab")) {
            return SourceFormat.TSV;
        }
        if (lower.endsWith(".csv") || lower.endsWith(".txt")) {
            return SourceFormat.CSV;
        }
        return null;
    }

    private SourceFormat detectFormatByContentType(String contentType) {
        if (contentType == null) {
            return null;
        }
        if (contentType.contains("spreadsheetml")) {
            return SourceFormat.XLSX;
        }
        if (contentType.contains("tab-separated-values")) {
            return SourceFormat.TSV;
        }
        if (contentType.contains("text/csv") || contentType.contains("text/plain")) {
            return SourceFormat.CSV;
        }
        return null;
    }

    // Spreadsheet exports in Polish locales separate with semicolons; the first line tells which one was used.
    private SourceFormat sniffDelimiter(byte[] content) {
        String head = new String(content, 0, Math.min(content.length, SNIFF_BYTES), StandardCharsets.UTF_8);
        int lineEnd = head.indexOf('\n');
        String firstLine = lineEnd >= 0 ? head.substring(0, lineEnd) : head;
        long commas = firstLine.chars().filter(c -> c == ',').count();
        long semicolons = firstLine.chars().filter(c -> c == ';').count();
        long tabs = firstLine.chars().filter(c -> c == '\t').count();
        if (tabs > commas && tabs > semicolons) {
            return SourceFormat.TSV;
        }
        return semicolons > commas ? SourceFormat.SEMICOLON_CSV : SourceFormat.CSV;
    }

    private boolean startsWith(byte[] content, byte[] signature) {
        if (content.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (content[i] != signature[i]) {
                return false;
            }
        }
        return true;
    }

    private String safeName(String fileName, SourceFormat format) {
        if (fileName == null || fileName.isBlank()) {
            return "source." + format.extension();
        }
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        String cleaned = base.replaceAll("[^\\p{L}0-9._-]", "_");
        return cleaned.isBlank() || cleaned.startsWith(".") ? "source." + format.extension() : cleaned;
    }

    private String normalizeContentType(String contentType) {
        if (contentType == null) {
            return null;
        }
        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        int idx = normalized.indexOf(';');
        if (idx > 0) {
            normalized = normalized.substring(0, idx).trim();
        }
        return normalized.isBlank() ? null : normalized;
    }
}
