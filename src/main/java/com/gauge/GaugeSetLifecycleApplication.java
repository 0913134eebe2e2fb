package com.gauge;

import com.gauge.config.LifecycleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main entry point for the gauge set lifecycle service.
 * Pairs GO/NO-GO thread gauges into sets, allocates their identifiers and keeps
 * an append-only history of every lifecycle change.
 */
@SpringBootApplication
@EnableConfigurationProperties(LifecycleProperties.class)
public class GaugeSetLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(GaugeSetLifecycleApplication.class, args);
    }
}
