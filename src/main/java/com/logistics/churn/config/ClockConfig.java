package com.logistics.churn.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Source of "now" for passes that are not given an explicit reference time.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock analyticsClock(AnalyticsConfig config) {
        return Clock.system(config.zoneId());
    }
}
