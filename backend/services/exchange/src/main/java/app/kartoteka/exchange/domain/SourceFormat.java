package app.kartoteka.exchange.domain;

public enum SourceFormat {
    CSV(',', "csv", "text/csv"),
    SEMICOLON_CSV(';', "csv", "text/csv"),
    TSV('\t', "tsv", "text/tab-separated-values"),
    XLSX((char) 0, "xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final char delimiter;
    private final String extension;
    private final String contentType;

    SourceFormat(char delimiter, String extension, String contentType) {
        this.delimiter = delimiter;
        this.extension = extension;
        this.contentType = contentType;
    }

    public char delimiter() {
        return delimiter;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }

    public boolean isDelimited() {
        return this != XLSX;
    }
}
