package app.kartoteka.exchange.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JobCountersTest {

    @Test
    void outcomesAlwaysAddUpToProcessed() {
        JobCounters counters = new JobCounters(4);
        counters.success();
        counters.success();
        counters.failure();
        counters.skip();

        assertEquals(4, counters.processed());
        assertEquals(counters.processed(), counters.successful() + counters.failed() + counters.skipped());
    }

    @Test
    void totalGrowsWhenMoreRowsArriveThanCounted() {
        JobCounters counters = new JobCounters(1);
        counters.success();
        counters.success();

        assertEquals(2, counters.total());
    }
}
