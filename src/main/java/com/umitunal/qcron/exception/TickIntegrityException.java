package com.umitunal.qcron.exception;

/**
 * Thrown when a tick runs while its own task handle is in an unexpected state.
 * Indicates a duplicate delivery or a logic defect; never retried.
 */
public class TickIntegrityException extends CronJobException {

    public TickIntegrityException(String message) {
        super(message);
    }
}
