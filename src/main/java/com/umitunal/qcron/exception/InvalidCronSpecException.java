package com.umitunal.qcron.exception;

/**
 * Thrown when a cron expression cannot be parsed.
 */
public class InvalidCronSpecException extends CronJobException {

    private final String cronspec;

    public InvalidCronSpecException(String cronspec) {
        super("Invalid cronspec: \"" + cronspec + "\"");
        this.cronspec = cronspec;
    }

    public InvalidCronSpecException(String cronspec, Throwable cause) {
        super("Invalid cronspec: \"" + cronspec + "\"", cause);
        this.cronspec = cronspec;
    }

    public String getCronspec() {
        return cronspec;
    }
}
