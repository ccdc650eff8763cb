package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.domain.SourceFormat;
import app.kartoteka.exchange.store.ExportFilter;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CreateExportJobRequest(
        @NotNull SourceFormat format,
        ExportFilter filter,
        List<String> fields
) {
}
