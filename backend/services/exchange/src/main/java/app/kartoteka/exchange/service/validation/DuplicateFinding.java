package app.kartoteka.exchange.service.validation;

import java.util.UUID;

public record DuplicateFinding(
        int rowNumber,
        String keyValue,
        boolean existsInFile,
        Integer firstRowNumber,
        boolean existsInDb,
        UUID existingRecordId
) {
}
