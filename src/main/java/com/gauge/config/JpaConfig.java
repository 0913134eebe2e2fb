package com.gauge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Populates createdAt / updatedAt on gauge rows.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
