package app.kartoteka.exchange.service.parser;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class XlsxImportParserTest {

    private final XlsxImportParser parser = new XlsxImportParser();

    @Test
    void readsFirstSheetWithPhysicalRowNumbers() throws IOException {
        byte[] workbook = workbook(sheet -> {
            row(sheet, 0, "companyName", "nip", "employees");
            row(sheet, 1, "Acme", "5270103391");
            sheet.getRow(1).createCell(2).setCellValue(42);
            // row index 2 is never written
            row(sheet, 3, "Beta", "");
        });

        List<ImportRecord> records = readAll(workbook, ParseOptions.defaults());

        assertEquals(2, records.size());
        assertEquals(2, records.get(0).rowNumber());
        assertEquals("Acme", records.get(0).fields().get("companyName"));
        assertEquals("42", records.get(0).fields().get("employees"));
        assertEquals(4, records.get(1).rowNumber());
        assertEquals("Beta", records.get(1).fields().get("companyName"));
    }

    @Test
    void repeatedHeaderTakesLastColumnEvenWhenItsCellIsMissing() throws IOException {
        byte[] workbook = workbook(sheet -> {
            row(sheet, 0, "nip", "nip", "city");
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue("5270103391");
            data.createCell(2).setCellValue("Gdańsk");
        });

        List<ImportRecord> records = readAll(workbook, ParseOptions.defaults());

        assertEquals("", records.get(0).fields().get("nip"));
        assertEquals("Gdańsk", records.get(0).fields().get("city"));
    }

    @Test
    void skipsPreambleRows() throws IOException {
        byte[] workbook = workbook(sheet -> {
            row(sheet, 0, "Client list");
            row(sheet, 1, "nip");
            row(sheet, 2, "5270103391");
        });

        List<ImportRecord> records = readAll(workbook, new ParseOptions(null, 2, 0));

        assertEquals(1, records.size());
        assertEquals(3, records.get(0).rowNumber());
        assertEquals("5270103391", records.get(0).fields().get("nip"));
    }

    @Test
    void rejectsWorkbookWithoutHeader() throws IOException {
        byte[] workbook = workbook(sheet -> row(sheet, 1, "nip"));

        ImportParseException ex = assertThrows(ImportParseException.class, () -> readAll(workbook, ParseOptions.defaults()));

        assertEquals("File has no header row", ex.getReason());
    }

    @Test
    void rejectsEmptySheet() throws IOException {
        byte[] workbook = workbook(sheet -> {
        });

        ImportParseException ex = assertThrows(ImportParseException.class, () -> readAll(workbook, ParseOptions.defaults()));

        assertEquals("File is empty", ex.getReason());
    }

    @Test
    void rejectsContentThatIsNotAWorkbook() {
        byte[] content = "nip\n5270103391\n".getBytes(StandardCharsets.UTF_8);

        assertThrows(ImportParseException.class, () -> readAll(content, ParseOptions.defaults()));
    }

    @Test
    void enforcesRowLimit() throws IOException {
        byte[] workbook = workbook(sheet -> {
            row(sheet, 0, "nip");
            row(sheet, 1, "1");
            row(sheet, 2, "2");
        });

        assertThrows(ImportParseException.class, () -> readAll(workbook, new ParseOptions(null, 1, 1)));
    }

    private List<ImportRecord> readAll(byte[] content, ParseOptions options) throws IOException {
        List<ImportRecord> records = new ArrayList<>();
        try (ImportStream stream = parser.openStream(new ByteArrayInputStream(content), options)) {
            while (stream.hasNext()) {
                records.add(stream.next());
            }
        }
        return records;
    }

    private interface SheetWriter {
        void write(Sheet sheet);
    }

    private static byte[] workbook(SheetWriter writer) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            writer.write(workbook.createSheet("clients"));
            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static void row(Sheet sheet, int index, String... values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.length; i++) {
            row.createCell(i).setCellValue(values[i]);
        }
    }
}
