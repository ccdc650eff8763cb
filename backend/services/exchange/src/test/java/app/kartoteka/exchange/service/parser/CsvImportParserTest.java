package app.kartoteka.exchange.service.parser;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvImportParserTest {

    @Test
    void readsRowsKeyedByTrimmedHeader() throws IOException {
        String csv = "companyName , nip\nAcme Sp. z o.o.,5270103391\n\"Kowalski, Nowak\",\n";

        List<ImportRecord> records = readAll(new CsvImportParser(','), csv, ParseOptions.defaults());

        assertEquals(2, records.size());
        assertEquals(2, records.get(0).rowNumber());
        assertEquals("Acme Sp. z o.o.", records.get(0).fields().get("companyName"));
        assertEquals("5270103391", records.get(0).fields().get("nip"));
        assertEquals("Kowalski, Nowak", records.get(1).fields().get("companyName"));
        assertEquals("", records.get(1).fields().get("nip"));
    }

    @Test
    void repeatedHeaderTakesLastColumn() throws IOException {
        String csv = "nip,nip,city\n5270103391,,Gdańsk\n1234563218,5213017228,Sopot\n";

        List<ImportRecord> records = readAll(new CsvImportParser(','), csv, ParseOptions.defaults());

        assertEquals("", records.get(0).fields().get("nip"));
        assertEquals("5213017228", records.get(1).fields().get("nip"));
    }

    @Test
    void shortRowsReadAsEmptyInMissingColumns() throws IOException {
        String csv = "companyName,nip,city\nAcme\n";

        List<ImportRecord> records = readAll(new CsvImportParser(','), csv, ParseOptions.defaults());

        assertEquals("Acme", records.get(0).fields().get("companyName"));
        assertEquals("", records.get(0).fields().get("nip"));
        assertEquals("", records.get(0).fields().get("city"));
    }

    @Test
    void skipsBlankRowsButKeepsPhysicalRowNumbers() throws IOException {
        String csv = "name;city\nA;Gdańsk\n\n;\nB;Kraków\n";

        List<ImportRecord> records = readAll(new CsvImportParser(';'), csv, ParseOptions.defaults());

        assertEquals(2, records.size());
        assertEquals(2, records.get(0).rowNumber());
        assertEquals(5, records.get(1).rowNumber());
        assertEquals("Kraków", records.get(1).fields().get("city"));
    }

    @Test
    void stripsByteOrderMark() throws IOException {
        String csv = "\uFEFFnip\n5270103391\n";

        try (ImportStream stream = new CsvImportParser(',').openStream(utf8(csv), ParseOptions.defaults())) {
            assertEquals(List.of("nip"), stream.fields());
            assertEquals("5270103391", stream.next().fields().get("nip"));
        }
    }

    @Test
    void usesLastPreambleRowAsHeader() throws IOException {
        String csv = "Client export 2024\nname\tcity\nA\tŁódź\n";

        List<ImportRecord> records = readAll(new CsvImportParser('\t'), csv, new ParseOptions(null, 2, 0));

        assertEquals(1, records.size());
        assertEquals(3, records.get(0).rowNumber());
        assertEquals("Łódź", records.get(0).fields().get("city"));
    }

    @Test
    void decodesDeclaredEncoding() throws IOException {
        byte[] content = "name\nŻółć\n".getBytes(Charset.forName("windows-1250"));

        try (ImportStream stream = new CsvImportParser(',').openStream(new ByteArrayInputStream(content),
                new ParseOptions("windows-1250", 1, 0))) {
            assertEquals("Żółć", stream.next().fields().get("name"));
        }
    }

    @Test
    void rejectsMalformedUtf8() {
        byte[] content = {'n', 'a', 'm', 'e', '\n', (byte) 0xC3, (byte) 0x28, '\n'};

        assertThrows(ImportParseException.class, () -> readAll(new CsvImportParser(','), content, ParseOptions.defaults()));
    }

    @Test
    void rejectsEmptyFileAndMissingHeader() {
        ImportParseException empty = assertThrows(ImportParseException.class,
                () -> readAll(new CsvImportParser(','), "", ParseOptions.defaults()));
        assertEquals("File is empty", empty.getReason());

        ImportParseException noHeader = assertThrows(ImportParseException.class,
                () -> readAll(new CsvImportParser(','), "only preamble\n", new ParseOptions(null, 2, 0)));
        assertEquals("File has no header row", noHeader.getReason());
    }

    @Test
    void headerOnlyFileHasNoRecords() throws IOException {
        try (ImportStream stream = new CsvImportParser(',').openStream(utf8("nip,email\n"), ParseOptions.defaults())) {
            assertEquals(List.of("nip", "email"), stream.fields());
            assertFalse(stream.hasNext());
        }
    }

    @Test
    void enforcesRowLimit() {
        String csv = "nip\n1\n2\n3\n";

        ImportParseException ex = assertThrows(ImportParseException.class,
                () -> readAll(new CsvImportParser(','), csv, new ParseOptions(null, 1, 2)));

        assertTrue(ex.getReason().contains("more than 2"));
    }

    @Test
    void countsDataRows() throws IOException {
        String csv = "nip\n1\n\n2\n3\n";

        assertEquals(3, new CsvImportParser(',').countRows(utf8(csv), ParseOptions.defaults()));
    }

    private static List<ImportRecord> readAll(ImportParser parser, String content, ParseOptions options) throws IOException {
        return readAll(parser, content.getBytes(StandardCharsets.UTF_8), options);
    }

    private static List<ImportRecord> readAll(ImportParser parser, byte[] content, ParseOptions options) throws IOException {
        List<ImportRecord> records = new ArrayList<>();
        try (ImportStream stream = parser.openStream(new ByteArrayInputStream(content), options)) {
            while (stream.hasNext()) {
                records.add(stream.next());
            }
        }
        return records;
    }

    private static ByteArrayInputStream utf8(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
