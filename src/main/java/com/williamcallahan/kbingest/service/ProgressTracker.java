package com.williamcallahan.kbingest.service;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts items through one pipeline pass and decides when a progress line is due.
 */
public class ProgressTracker {
    private static final int LOG_EVERY_PERCENT = 10;

    private final long total;
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong succeededCount = new AtomicLong(0);
    private long lastReportedDecile = -1;

    public ProgressTracker(long total) {
        this.total = Math.max(0, total);
    }

    /**
     * Records one item and returns true when it crossed into a new 10% band (or finished the pass).
     */
    public synchronized boolean markProcessed(boolean succeeded) {
        long processed = processedCount.incrementAndGet();
        if (succeeded) {
            succeededCount.incrementAndGet();
        }
        long decile = (long) (percentComplete() / LOG_EVERY_PERCENT);
        if (decile != lastReportedDecile || processed == total) {
            lastReportedDecile = decile;
            return true;
        }
        return false;
    }

    public long getProcessedCount() { return processedCount.get(); }
    public long getSucceededCount() { return succeededCount.get(); }
    public long getTotal() { return total; }

    public double percentComplete() {
        if (total <= 0) return 100.0;
        return Math.max(0.0, Math.min(100.0, (processedCount.get() * 100.0) / total));
    }

    public String formatPercent() {
        return String.format(Locale.ROOT, "%.1f%%", percentComplete());
    }
}
