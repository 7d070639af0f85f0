package com.reviewroster.scheduler.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // status_since is compared by calendar date in the database session zone, which is the JVM default here.
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
