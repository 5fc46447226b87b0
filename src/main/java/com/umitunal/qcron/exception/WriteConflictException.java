package com.umitunal.qcron.exception;

/**
 * Raised when a transaction loses an optimistic concurrency check at commit time.
 */
public class WriteConflictException extends StoreException {

    public WriteConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
