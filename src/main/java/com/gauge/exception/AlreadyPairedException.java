package com.gauge.exception;

/** A gauge expected to be a spare already belongs to a set. */
public class AlreadyPairedException extends GaugeValidationException {

    public AlreadyPairedException(String message) {
        super("ALREADY_PAIRED", message);
    }

    public AlreadyPairedException(String message, String field, Object expected, Object actual) {
        super("ALREADY_PAIRED", message, field, expected, actual);
    }
}
