package com.umitunal.qcron.exception;

/**
 * Thrown when a named job is registered under a name that is already taken.
 */
public class DuplicateNameException extends CronJobException {

    private final String name;

    public DuplicateNameException(String name) {
        super("Cron job with name \"" + name + "\" already exists");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
