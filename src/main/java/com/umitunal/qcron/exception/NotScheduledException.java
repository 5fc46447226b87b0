package com.umitunal.qcron.exception;

/**
 * Thrown when a cron job record has no outstanding tick task.
 */
public class NotScheduledException extends CronJobException {

    public NotScheduledException(String jobId) {
        super("Cron job " + jobId + " not scheduled");
    }
}
