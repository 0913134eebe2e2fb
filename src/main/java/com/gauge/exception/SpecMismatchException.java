package com.gauge.exception;

/** The two gauges do not share the same size, class, form and type. */
public class SpecMismatchException extends GaugeValidationException {

    public SpecMismatchException(String message) {
        super("SPEC_MISMATCH", message);
    }

    public SpecMismatchException(String message, String field, Object expected, Object actual) {
        super("SPEC_MISMATCH", message, field, expected, actual);
    }
}
