package app.kartoteka.exchange.controller.dto;

import app.kartoteka.exchange.domain.JobKind;
import app.kartoteka.exchange.domain.JobStatus;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(
        UUID id,
        JobKind kind,
        JobStatus status,
        String fileName,
        int total,
        int processed,
        int successful,
        int failed,
        int skipped,
        double progressPercent,
        long errorCount,
        String resultArtifactRef,
        Instant startedAt,
        Instant completedAt,
        Long estimatedSecondsRemaining,
        String errorMessage,
        Instant createdAt
) {
}
