package com.gauge.exception;

/** A set member is checked out. */
public class CheckedOutException extends GaugeValidationException {

    public CheckedOutException(String message) {
        super("CHECKED_OUT", message);
    }

    public CheckedOutException(String message, String field, Object expected, Object actual) {
        super("CHECKED_OUT", message, field, expected, actual);
    }
}
