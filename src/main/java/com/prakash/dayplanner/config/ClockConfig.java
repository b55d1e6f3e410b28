package com.prakash.dayplanner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Exposes the clock used for "now" in urgency and earliness scoring.
 * Tests replace it with {@link Clock#fixed} to get repeatable plans.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
