package app.kartoteka.exchange.service.parser;

import app.kartoteka.exchange.domain.SourceFormat;
import org.springframework.stereotype.Component;

@Component
public class ImportParserFactory {

    public ImportParser create(SourceFormat format) {
        if (format == null) {
            throw new ImportParseException("Source format is required");
        }
        return switch (format) {
            case CSV, SEMICOLON_CSV, TSV -> new CsvImportParser(format.delimiter());
            case XLSX -> new XlsxImportParser();
        };
    }
}
