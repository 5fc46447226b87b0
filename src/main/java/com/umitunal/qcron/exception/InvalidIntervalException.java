package com.umitunal.qcron.exception;

/**
 * Thrown when an interval schedule is shorter than the minimum interval.
 */
public class InvalidIntervalException extends CronJobException {

    private final long intervalMs;

    public InvalidIntervalException(long intervalMs, long minimumMs) {
        super("Interval must be >= " + minimumMs + "ms, got " + intervalMs + "ms");
        this.intervalMs = intervalMs;
    }

    public long getIntervalMs() {
        return intervalMs;
    }
}
