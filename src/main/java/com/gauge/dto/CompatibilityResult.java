package com.gauge.dto;

/**
 * Outcome of a pairing dry run. code is null when valid.
 */
public record CompatibilityResult(boolean valid, String code, String message) {

    public static CompatibilityResult ok() {
        return new CompatibilityResult(true, null, "Gauges are compatible");
    }
}
