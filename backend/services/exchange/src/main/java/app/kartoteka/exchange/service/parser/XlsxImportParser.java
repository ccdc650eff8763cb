package app.kartoteka.exchange.service.parser;

import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

public class XlsxImportParser implements ImportParser {

    @Override
    public XlsxImportStream openStream(InputStream inputStream, ParseOptions options) throws IOException {
        Workbook workbook;
        try {
            workbook = new XSSFWorkbook(inputStream);
        } catch (IllegalArgumentException | POIXMLException ex) {
            throw new ImportParseException("File is not a readable XLSX workbook", ex);
        }
        if (workbook.getNumberOfSheets() == 0) {
            workbook.close();
            throw new ImportParseException("File is empty");
        }
        try {
            return new XlsxImportStream(workbook, options);
        } catch (ImportParseException ex) {
            workbook.close();
            throw ex;
        }
    }

    public static class XlsxImportStream implements ImportStream {
        private final Workbook workbook;
        private final Iterator<Row> rows;
        private final DataFormatter formatter = new DataFormatter();
        private final FormulaEvaluator evaluator;
        private final List<String> headers;
        private final int maxRows;
        private int returned;
        private ImportRecord nextRecord;

        XlsxImportStream(Workbook workbook, ParseOptions options) {
            this.workbook = workbook;
            this.evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            this.maxRows = options.maxRows();
            Sheet sheet = workbook.getSheetAt(0);
            if (sheet.getPhysicalNumberOfRows() == 0) {
                throw new ImportParseException("File is empty");
            }
            int headerIndex = options.headerRows() - 1;
            Row header = sheet.getRow(headerIndex);
            if (header == null || isBlank(header)) {
                throw new ImportParseException("File has no header row");
            }
            List<String> names = new ArrayList<>();
            for (int i = 0; i < header.getLastCellNum(); i++) {
                names.add(cellText(header.getCell(i)).trim());
            }
            this.headers = List.copyOf(names);
            this.rows = sheet.rowIterator();
            this.nextRecord = advance(headerIndex);
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
            nextRecord = advance(current.rowNumber() - 1);
            return current;
        }

        @Override
        public void close() throws IOException {
            workbook.close();
        }

        // POI skips rows that were never written, so row indexes, not iteration counts, give the physical row.
        private ImportRecord advance(int afterIndex) {
            while (rows.hasNext()) {
                Row row = rows.next();
                if (row.getRowNum() <= afterIndex || isBlank(row)) {
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                // empty cells are often not stored at all, they still count as a value for a repeated header
                for (int i = 0; i < headers.size(); i++) {
                    values.put(headers.get(i), cellText(row.getCell(i)));
                }
                return new ImportRecord(row.getRowNum() + 1, values);
            }
            return null;
        }

        private boolean isBlank(Row row) {
            for (Cell cell : row) {
                if (!cellText(cell).isBlank()) {
                    return false;
                }
            }
            return true;
        }

        private String cellText(Cell cell) {
            if (cell == null) {
                return "";
            }
            return formatter.formatCellValue(cell, evaluator);
        }
    }
}
