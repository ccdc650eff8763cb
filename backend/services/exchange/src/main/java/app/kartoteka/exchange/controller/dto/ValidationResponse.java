package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.service.validation.ValidationReport;

import java.util.UUID;

public record ValidationResponse(
        UUID jobId,
        ValidationReport report
) {
}
