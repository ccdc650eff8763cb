package app.kartoteka.exchange.service.parser;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

public class CsvImportParser implements ImportParser {

    private static final char BOM = '\uFEFF';

    private final char delimiter;

    public CsvImportParser(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public CsvImportStream openStream(InputStream inputStream, ParseOptions options) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(false)
                .setTrim(false)
                .build();
        Reader reader = skipBom(new BufferedReader(new InputStreamReader(inputStream, decoderFor(options.encoding()))));
        CSVParser parser = new CSVParser(reader, format);
        return new CsvImportStream(parser, options);
    }

    private static CharsetDecoder decoderFor(String encoding) {
        Charset charset;
        try {
            charset = encoding == null || encoding.isBlank() ? StandardCharsets.UTF_8 : Charset.forName(encoding.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            throw new ImportParseException("Unsupported encoding: " + encoding, ex);
        }
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static Reader skipBom(BufferedReader reader) throws IOException {
        reader.mark(1);
        int first;
        try {
            first = reader.read();
        } catch (CharacterCodingException ex) {
            throw new ImportParseException("File is not readable in the declared encoding", ex);
        }
        if (first != BOM) {
            reader.reset();
        }
        return reader;
    }

    public static class CsvImportStream implements ImportStream {
        private final CSVParser parser;
        private final Iterator<CSVRecord> iterator;
        private final List<String> headers;
        private final int maxRows;
        private int physicalRow;
        private int returned;
        private ImportRecord nextRecord;

        CsvImportStream(CSVParser parser, ParseOptions options) {
            this.parser = parser;
            this.iterator = parser.iterator();
            this.maxRows = options.maxRows();
            CSVRecord header = null;
            for (int i = 0; i < options.headerRows(); i++) {
                if (!hasMoreRecords()) {
                    break;
                }
                header = nextRecord();
            }
            if (physicalRow == 0) {
                throw new ImportParseException("File is empty");
            }
            if (header == null || physicalRow < options.headerRows() || isBlank(header)) {
                throw new ImportParseException("File has no header row");
            }
            List<String> names = new ArrayList<>();
            for (String value : header) {
                names.add(value == null ? "" : value.trim());
            }
            this.headers = List.copyOf(names);
            this.nextRecord = advance();
        }

        @Override
        public List<String> fields() {
            return headers;
        }

        @Override
        public boolean hasNext() {
            return nextRecord != null;
        }

        @Override
        public ImportRecord next() {
            if (nextRecord == null) {
                throw new NoSuchElementException();
            }
            ImportRecord current = nextRecord;
            returned++;
            if (maxRows > 0 && returned > maxRows) {
                throw new ImportParseException("File has more than " + maxRows + " data rows");
            }
            nextRecord = advance();
            return current;
        }

        @Override
        public void close() throws IOException {
            parser.close();
        }

        private ImportRecord advance() {
            while (hasMoreRecords()) {
                CSVRecord record = nextRecord();
                if (isBlank(record)) {
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                // short rows read as empty in their trailing columns
                for (int i = 0; i < headers.size(); i++) {
                    values.put(headers.get(i), i < record.size() ? record.get(i) : "");
                }
                return new ImportRecord(physicalRow, values);
            }
            return null;
        }

        private boolean hasMoreRecords() {
            try {
                return iterator.hasNext();
            } catch (UncheckedIOException | IllegalStateException ex) {
                throw new ImportParseException("File is not readable as delimited text near row " + (physicalRow + 1), ex);
            }
        }

        private CSVRecord nextRecord() {
            try {
                CSVRecord record = iterator.next();
                physicalRow++;
                return record;
            } catch (UncheckedIOException | IllegalStateException ex) {
                throw new ImportParseException("File is not readable as delimited text near row " + (physicalRow + 1), ex);
            }
        }

        private static boolean isBlank(CSVRecord record) {
            for (String value : record) {
                if (value != null && !value.isBlank()) {
                    return false;
                }
            }
            return true;
        }
    }
}
