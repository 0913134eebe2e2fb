package com.gauge.exception;

/** Company and customer gauges, or gauges of different customers, cannot be companions. */
public class OwnershipMismatchException extends GaugeValidationException {

    public OwnershipMismatchException(String message) {
        super("OWNERSHIP_MISMATCH", message);
    }

    public OwnershipMismatchException(String message, String field, Object expected, Object actual) {
        super("OWNERSHIP_MISMATCH", message, field, expected, actual);
    }
}
