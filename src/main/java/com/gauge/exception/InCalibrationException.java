package com.gauge.exception;

/** A set member is inside the calibration workflow. */
public class InCalibrationException extends GaugeValidationException {

    public InCalibrationException(String message) {
        super("IN_CALIBRATION", message);
    }

    public InCalibrationException(String message, String field, Object expected, Object actual) {
        super("IN_CALIBRATION", message, field, expected, actual);
    }
}
