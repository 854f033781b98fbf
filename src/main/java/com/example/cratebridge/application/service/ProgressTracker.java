package com.example.cratebridge.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards job progress to a {@link ProgressListener} with a percentage that never goes backwards,
 * and logs milestones every 10%.
 *
 * <p>Counters for processed, skipped and failed items feed the milestone and summary log lines.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final String jobName;
    private final ProgressListener listener;
    private final long startTimeMs;
    private final int logIntervalItems;

    private int lastPercent;
    private int lastMilestoneBucket = -1;
    private int itemsProcessed;
    private int itemsSkipped;
    private int itemsFailed;
    private int lastLoggedItems;

    public ProgressTracker(String jobName, ProgressListener listener) {
        this(jobName, listener, 200);
    }

    public ProgressTracker(String jobName, ProgressListener listener, int logIntervalItems) {
        this.jobName = jobName;
        this.listener = listener == null ? ProgressListener.NONE : listener;
        this.startTimeMs = System.currentTimeMillis();
        this.logIntervalItems = logIntervalItems > 0 ? logIntervalItems : 200;
    }

    // ════════════════════════════════════════════════════════
    // Reporting
    // ════════════════════════════════════════════════════════

    public void report(int percent, String message) {
        emit(percent, message, null, null);
    }

    public void report(int percent, String message, int current, int total) {
        emit(percent, message, current, total);
    }

    private void emit(int percent, String message, Integer current, Integer total) {
        int bounded = Math.max(0, Math.min(100, percent));
        if (bounded < lastPercent) {
            bounded = lastPercent;
        }
        lastPercent = bounded;
        try {
            listener.onProgress(bounded, message, current, total);
        } catch (RuntimeException e) {
            log.warn("PROGRESS_LISTENER_FAILED job={} percent={} reason={}", jobName, bounded, e.getMessage());
        }
        checkMilestone(current, total);
    }

    // ════════════════════════════════════════════════════════
    // Item counters
    // ════════════════════════════════════════════════════════

    public void onItemProcessed() {
        itemsProcessed++;
        if (itemsProcessed - lastLoggedItems >= logIntervalItems) {
            lastLoggedItems = itemsProcessed;
            log.info("{}_PROGRESS percent={} processed={} skipped={} failed={} elapsed={}",
                    jobName, lastPercent, itemsProcessed, itemsSkipped, itemsFailed,
                    formatElapsed(getElapsedMs()));
        }
    }

    public void onItemSkipped() {
        itemsSkipped++;
    }

    public void onItemFailed() {
        itemsFailed++;
    }

    // ════════════════════════════════════════════════════════
    // Milestone detection
    // ════════════════════════════════════════════════════════

    private void checkMilestone(Integer current, Integer total) {
        int bucket = lastPercent / 10;
        if (bucket > lastMilestoneBucket) {
            lastMilestoneBucket = bucket;
            if (bucket > 0) {
                log.info("{}_MILESTONE {}% | item={}/{} processed={} skipped={} failed={} elapsed={}",
                        jobName, bucket * 10,
                        current == null ? "-" : current, total == null ? "-" : total,
                        itemsProcessed, itemsSkipped, itemsFailed, formatElapsed(getElapsedMs()));
            }
        }
    }

    public long getElapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public String formatElapsed(long elapsedMs) {
        if (elapsedMs < 1000) {
            return elapsedMs + "ms";
        }
        long seconds = elapsedMs / 1000;
        long minutes = seconds / 60;
        long remainSeconds = seconds % 60;
        if (minutes <= 0) {
            return seconds + "s";
        }
        long hours = minutes / 60;
        long remainMinutes = minutes % 60;
        if (hours <= 0) {
            return minutes + "m" + remainSeconds + "s";
        }
        return hours + "h" + remainMinutes + "m" + remainSeconds + "s";
    }

    // ════════════════════════════════════════════════════════
    // Getters
    // ════════════════════════════════════════════════════════

    public int getLastPercent() { return lastPercent; }
    public int getItemsProcessed() { return itemsProcessed; }
    public int getItemsSkipped() { return itemsSkipped; }
    public int getItemsFailed() { return itemsFailed; }
}
