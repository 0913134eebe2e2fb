package com.gauge.exception;

import lombok.Getter;

/**
 * A business rule rejected the request before anything was written.
 *
 * Carries a stable code plus the offending field with its expected and actual
 * values so callers can build an actionable message. The message itself is
 * suitable for direct display.
 */
@Getter
public class GaugeValidationException extends GaugeLifecycleException {

    private final String code;
    private final String field;
    private final Object expected;
    private final Object actual;

    public GaugeValidationException(String code, String message) {
        this(code, message, null, null, null);
    }

    public GaugeValidationException(String code, String message, String field, Object expected, Object actual) {
        super(message);
        this.code = code;
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }
}
