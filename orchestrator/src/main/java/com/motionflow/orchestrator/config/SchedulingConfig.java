package com.motionflow.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Background processing switches.
 *
 * Scheduling is off under the "test" profile so context tests never start
 * claiming rows. Event listeners run on Spring's async executor so a slow
 * notification sink cannot hold a worker.
 */
@Configuration
@EnableAsync
public class SchedulingConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Configuration
    @EnableScheduling
    @Profile("!test")
    static class Scheduling {}
}
