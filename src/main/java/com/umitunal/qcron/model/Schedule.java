package com.umitunal.qcron.model;

import com.umitunal.qcron.exception.InvalidCronSpecException;
import com.umitunal.qcron.exception.InvalidIntervalException;

import java.util.Objects;

/**
 * How often a cron job fires: a fixed interval or a cron expression.
 * Immutable once a job is registered.
 */
public final class Schedule {

    /**
     * Shortest interval accepted for interval schedules.
     */
    public static final long MIN_INTERVAL_MS = 1000;

    private final Kind kind;
    private final long intervalMs;
    private final String cronspec;

    private Schedule(Kind kind, long intervalMs, String cronspec) {
        this.kind = kind;
        this.intervalMs = intervalMs;
        this.cronspec = cronspec;
    }

    /**
     * Fire every {@code ms} milliseconds.
     *
     * @throws InvalidIntervalException if {@code ms} is below {@link #MIN_INTERVAL_MS}
     */
    public static Schedule interval(long ms) {
        if (ms < MIN_INTERVAL_MS) {
            throw new InvalidIntervalException(ms, MIN_INTERVAL_MS);
        }
        return new Schedule(Kind.INTERVAL, ms, null);
    }

    /**
     * Fire according to a cron expression. Grammar is checked by the fire time calculator.
     */
    public static Schedule cron(String cronspec) {
        if (cronspec == null || cronspec.isBlank()) {
            throw new InvalidCronSpecException(String.valueOf(cronspec));
        }
        return new Schedule(Kind.CRON, 0, cronspec.trim());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isInterval() {
        return kind == Kind.INTERVAL;
    }

    public boolean isCron() {
        return kind == Kind.CRON;
    }

    /**
     * Interval length; only meaningful for {@link Kind#INTERVAL}.
     */
    public long getIntervalMs() {
        return intervalMs;
    }

    /**
     * Cron expression; null for {@link Kind#INTERVAL}.
     */
    public String getCronspec() {
        return cronspec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schedule)) return false;
        Schedule other = (Schedule) o;
        return kind == other.kind
                && intervalMs == other.intervalMs
                && Objects.equals(cronspec, other.cronspec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, intervalMs, cronspec);
    }

    @Override
    public String toString() {
        return kind == Kind.INTERVAL
                ? "every " + intervalMs + " ms"
                : "cronspec \"" + cronspec + "\"";
    }

    public enum Kind {
        INTERVAL,
        CRON
    }
}
