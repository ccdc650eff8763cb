package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.domain.SourceFormat;

public record UploadResponse(
        String sourceKey,
        String fileName,
        SourceFormat format,
        long sizeBytes
) {
}
