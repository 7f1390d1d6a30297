package com.example.relay.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the expiry and purge sweeps for every profile except 'no-scheduling',
 * which tests use to drive sweeps by hand.
 */
@Configuration
@EnableScheduling
@Profile("!no-scheduling")
public class SchedulingConditionalConfig {
}
