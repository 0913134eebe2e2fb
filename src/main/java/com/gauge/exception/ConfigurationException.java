package com.gauge.exception;

/**
 * Missing or broken reference configuration, e.g. no identifier sequence for a
 * category. An operator fault; never retried.
 */
public class ConfigurationException extends GaugeLifecycleException {

    public ConfigurationException(String message) {
        super(message);
    }
}
