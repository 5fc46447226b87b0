package com.umitunal.qcron.config;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Configuration for cron evaluation, the in-process task scheduler and the janitor.
 */
public class SchedulerConfig {
    private final ZoneId cronZone;
    private final int schedulerThreads;
    private final long taskRetentionMillis;
    private final long janitorPollInterval;

    private SchedulerConfig(Builder builder) {
        this.cronZone = builder.cronZone;
        this.schedulerThreads = builder.schedulerThreads;
        this.taskRetentionMillis = builder.taskRetentionMillis;
        this.janitorPollInterval = builder.janitorPollInterval;
    }

    public ZoneId getCronZone() { return cronZone; }
    public int getSchedulerThreads() { return schedulerThreads; }
    public long getTaskRetentionMillis() { return taskRetentionMillis; }
    public long getJanitorPollInterval() { return janitorPollInterval; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static SchedulerConfig defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private ZoneId cronZone = ZoneOffset.UTC;
        private int schedulerThreads = 4;
        private long taskRetentionMillis = 60 * 60 * 1000L;
        private long janitorPollInterval = 60 * 1000L;

        private Builder() {
        }

        /**
         * Time zone cron expressions are evaluated in.
         * Default: UTC
         */
        public Builder withCronZone(ZoneId zone) {
            this.cronZone = zone;
            return this;
        }

        /**
         * Threads running due tasks in the in-process scheduler.
         * Default: 4
         */
        public Builder withSchedulerThreads(int count) {
            this.schedulerThreads = count;
            return this;
        }

        /**
         * How long finished tasks stay queryable before they are forgotten.
         * A forgotten dispatch task counts as finished for overlap detection.
         * Default: 1 hour
         */
        public Builder withTaskRetention(long millis) {
            this.taskRetentionMillis = millis;
            return this;
        }

        /**
         * Delay between janitor sweeps.
         * Default: 60 seconds
         */
        public Builder withJanitorPollInterval(long millis) {
            this.janitorPollInterval = millis;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
