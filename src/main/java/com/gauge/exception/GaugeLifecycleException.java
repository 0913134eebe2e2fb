package com.gauge.exception;

/**
 * Root of every failure the lifecycle engine reports.
 *
 * Unchecked so that a throw inside a transaction callback rolls the transaction back.
 */
public abstract class GaugeLifecycleException extends RuntimeException {

    protected GaugeLifecycleException(String message) {
        super(message);
    }

    protected GaugeLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
