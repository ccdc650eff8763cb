package app.kartoteka.exchange.service.validation;

import java.util.List;

public record ValidationReport(
        boolean isValid,
        List<RowIssue> errors,
        List<DuplicateFinding> duplicates,
        int validRecords,
        int totalRecords
) {
}
