package app.kartoteka.exchange.service.parser;

public record ParseOptions(
        String encoding,
        int headerRows,
        int maxRows
) {
    public ParseOptions {
        if (headerRows < 1) {
            throw new ImportParseException("headerRows must be at least 1");
        }
        if (maxRows < 0) {
            maxRows = 0;
        }
    }

    public static ParseOptions defaults() {
        return new ParseOptions(null, 1, 0);
    }
}
