package com.arenabox.core.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic stale sweep.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "arenabox.sandbox.sweep-enabled", havingValue = "true")
public class SchedulingConfig {
}
