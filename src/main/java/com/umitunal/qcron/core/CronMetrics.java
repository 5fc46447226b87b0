package com.umitunal.qcron.core;

/**
 * Counts of registered cron jobs for monitoring.
 */
public class CronMetrics {
    private final long totalJobs;
    private final long intervalJobs;
    private final long cronJobs;
    private final long scheduledJobs;
    private final long stalledJobs;

    public CronMetrics(long totalJobs, long intervalJobs, long cronJobs,
                       long scheduledJobs, long stalledJobs) {
        this.totalJobs = totalJobs;
        this.intervalJobs = intervalJobs;
        this.cronJobs = cronJobs;
        this.scheduledJobs = scheduledJobs;
        this.stalledJobs = stalledJobs;
    }

    public long getTotalJobs() { return totalJobs; }
    public long getIntervalJobs() { return intervalJobs; }
    public long getCronJobs() { return cronJobs; }
    public long getScheduledJobs() { return scheduledJobs; }
    public long getStalledJobs() { return stalledJobs; }

    @Override
    public String toString() {
        return String.format(
            "CronMetrics{total=%d, interval=%d, cron=%d, scheduled=%d, stalled=%d}",
            totalJobs, intervalJobs, cronJobs, scheduledJobs, stalledJobs
        );
    }
}
