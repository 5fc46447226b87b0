package com.umitunal.qcron.service;

import com.umitunal.qcron.core.FireTimeCalculator;
import com.umitunal.qcron.model.Schedule;

import java.time.Instant;

/**
 * Next fire time of a schedule relative to an anchor time.
 */
final class FireTimes {

    private FireTimes() {
    }

    /**
     * @param anchorMillis registration time, the previous tick's scheduled time, or "now" for repairs
     */
    static long next(Schedule schedule, long anchorMillis, FireTimeCalculator calculator) {
        if (schedule.isInterval()) {
            return anchorMillis + schedule.getIntervalMs();
        }
        return calculator.nextFireTime(schedule.getCronspec(), Instant.ofEpochMilli(anchorMillis)).toEpochMilli();
    }
}
