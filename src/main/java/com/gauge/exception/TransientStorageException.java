package com.gauge.exception;

/**
 * Lock timeout, query timeout or lost connectivity. The transaction was rolled back
 * and the caller may retry the whole operation.
 */
public class TransientStorageException extends GaugeLifecycleException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
