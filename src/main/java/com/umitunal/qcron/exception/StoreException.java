package com.umitunal.qcron.exception;

/**
 * Wraps a failure of the underlying storage engine.
 */
public class StoreException extends CronJobException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
