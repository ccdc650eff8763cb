package app.kartoteka.exchange.service;

public final class JobCounters {

    private int total;
    private int processed;
    private int successful;
    private int failed;
    private int skipped;

    public JobCounters(int total) {
        this.total = total;
    }

    public void success() {
        processed++;
        successful++;
    }

    public void failure() {
        processed++;
        failed++;
    }

    public void skip() {
        processed++;
        skipped++;
    }

    public void settleTotal() {
        total = processed;
    }

    public int total() {
        return Math.max(total, processed);
    }

    public int processed() {
        return processed;
    }

    public int successful() {
        return successful;
    }

    public int failed() {
        return failed;
    }

    public int skipped() {
        return skipped;
    }
}
