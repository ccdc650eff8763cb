package app.kartoteka.exchange.service;

import java.time.Duration;
import java.time.Instant;

public record JobProgress(
        double percent,
        Long estimatedSecondsRemaining
) {
    public static JobProgress of(int total, int processed, Instant startedAt, Instant now) {
        double percent = total <= 0 ? 0.0 : Math.min(100.0, processed * 100.0 / total);
        Long eta = null;
        if (processed > 0 && startedAt != null && now != null) {
            long elapsedMillis = Math.max(0L, Duration.between(startedAt, now).toMillis());
            int remaining = Math.max(0, total - processed);
            eta = Math.round(elapsedMillis / 1000.0 / processed * remaining);
        }
        return new JobProgress(percent, eta);
    }
}
