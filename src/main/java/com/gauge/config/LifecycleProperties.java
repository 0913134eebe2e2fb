package com.gauge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tuning for the gauge set lifecycle engine.
 *
 * application.properties:
 *
 * gauge.lifecycle.set-sequence-sub-type=set
 * gauge.lifecycle.transaction-timeout-seconds=10
 * gauge.lifecycle.require-location-on-pair=false
 */
@ConfigurationProperties(prefix = "gauge.lifecycle")
public record LifecycleProperties(
        @DefaultValue("set") String setSequenceSubType,
        @DefaultValue("10")  int    transactionTimeoutSeconds,
        @DefaultValue("false") boolean requireLocationOnPair
) {}
