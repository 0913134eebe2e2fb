package com.gauge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Operational state of a gauge.
 *
 * Written by the checkout and calibration subsystems; the lifecycle engine only
 * reads it as a guard condition (and writes RETIRED on retirement).
 */
public enum GaugeStatus {

    AVAILABLE("available"),
    CHECKED_OUT("checked_out"),
    CALIBRATION_DUE("calibration_due"),
    PENDING_QC("pending_qc"),
    OUT_OF_SERVICE("out_of_service"),
    PENDING_UNSEAL("pending_unseal"),
    RETIRED("retired"),
    OUT_FOR_CALIBRATION("out_for_calibration"),
    PENDING_CERTIFICATE("pending_certificate"),
    PENDING_RELEASE("pending_release"),
    RETURNED("returned");

    private final String code;

    GaugeStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * A gauge that is out for calibration or waiting on its certificate/release
     * is still inside the calibration workflow.
     */
    public boolean isInCalibration() {
        return this == OUT_FOR_CALIBRATION || this == PENDING_CERTIFICATE || this == PENDING_RELEASE;
    }

    @JsonCreator
    public static GaugeStatus fromCode(String code) {
        return Arrays.stream(values())
            .filter(s -> s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown gauge status: " + code));
    }
}
