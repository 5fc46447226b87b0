package com.umitunal.qcron.exception;

/**
 * Thrown when a cron job record does not exist, either by id or by name.
 */
public class JobNotFoundException extends CronJobException {

    public JobNotFoundException(String message) {
        super(message);
    }

    public static JobNotFoundException forId(String jobId) {
        return new JobNotFoundException("Cron job " + jobId + " not found");
    }

    public static JobNotFoundException forName(String name) {
        return new JobNotFoundException("Cron job \"" + name + "\" not found");
    }
}
