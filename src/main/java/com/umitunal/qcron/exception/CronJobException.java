package com.umitunal.qcron.exception;

/**
 * Base type for every failure raised by the cron job library.
 */
public class CronJobException extends RuntimeException {

    public CronJobException(String message) {
        super(message);
    }

    public CronJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
