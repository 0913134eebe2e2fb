package com.gauge.exception;

/**
 * Unexpected storage fault. Logged with full context where it is raised and surfaced
 * to callers as an opaque failure.
 */
public class StorageFailureException extends GaugeLifecycleException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
