package app.kartoteka.exchange.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class JobProgressTest {

    private final Instant start = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void estimatesRemainingTimeFromAverageRate() {
        JobProgress progress = JobProgress.of(100, 25, start, start.plusSeconds(10));

        assertEquals(25.0, progress.percent());
        assertEquals(30L, progress.estimatedSecondsRemaining());
    }

    @Test
    void noEstimateBeforeFirstRecord() {
        JobProgress progress = JobProgress.of(100, 0, start, start.plusSeconds(10));

        assertEquals(0.0, progress.percent());
        assertNull(progress.estimatedSecondsRemaining());
    }

    @Test
    void emptyJobHasZeroPercent() {
        assertEquals(0.0, JobProgress.of(0, 0, null, null).percent());
    }

    @Test
    void percentNeverExceedsHundred() {
        assertEquals(100.0, JobProgress.of(10, 12, start, start.plusSeconds(1)).percent());
    }
}
