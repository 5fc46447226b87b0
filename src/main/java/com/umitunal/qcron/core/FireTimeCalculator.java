package com.umitunal.qcron.core;

import java.time.Instant;

/**
 * Computes fire times for cron expressions.
 */
public interface FireTimeCalculator {

    /**
     * Check that a cron expression is well formed.
     *
     * @throws com.umitunal.qcron.exception.InvalidCronSpecException if it is not
     */
    void validate(String cronspec);

    /**
     * Compute the first fire time strictly after {@code after}.
     *
     * @throws com.umitunal.qcron.exception.InvalidCronSpecException if the expression is malformed
     *         or never fires again
     */
    Instant nextFireTime(String cronspec, Instant after);
}
