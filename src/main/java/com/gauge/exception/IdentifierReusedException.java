package com.gauge.exception;

/** The identifier is in use or appears in the history ledger. */
public class IdentifierReusedException extends GaugeValidationException {

    public IdentifierReusedException(String message) {
        super("IDENTIFIER_REUSED", message);
    }

    public IdentifierReusedException(String message, String field, Object expected, Object actual) {
        super("IDENTIFIER_REUSED", message, field, expected, actual);
    }
}
