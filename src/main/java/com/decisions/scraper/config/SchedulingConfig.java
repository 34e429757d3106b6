package com.decisions.scraper.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background cache sweep. Switched off with
 * {@code scraper.scheduling.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "scraper.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
