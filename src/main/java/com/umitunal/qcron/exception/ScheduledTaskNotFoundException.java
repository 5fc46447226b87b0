package com.umitunal.qcron.exception;

/**
 * Thrown when the task scheduler has no record of a task handle a job points at.
 */
public class ScheduledTaskNotFoundException extends CronJobException {

    public ScheduledTaskNotFoundException(String taskId) {
        super("Scheduled task " + taskId + " not found");
    }
}
