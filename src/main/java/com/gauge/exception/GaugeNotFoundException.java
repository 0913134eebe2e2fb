package com.gauge.exception;

/** No active gauge (or set) exists for the given reference. */
public class GaugeNotFoundException extends GaugeValidationException {

    public GaugeNotFoundException(String message) {
        super("GAUGE_NOT_FOUND", message);
    }

    public GaugeNotFoundException(String message, String field, Object expected, Object actual) {
        super("GAUGE_NOT_FOUND", message, field, expected, actual);
    }
}
