package com.gauge.exception;

/** The equipment class or the category does not allow GO/NO-GO pairing. */
public class NonPairableCategoryException extends GaugeValidationException {

    public NonPairableCategoryException(String message) {
        super("NON_PAIRABLE_CATEGORY", message);
    }

    public NonPairableCategoryException(String message, String field, Object expected, Object actual) {
        super("NON_PAIRABLE_CATEGORY", message, field, expected, actual);
    }
}
