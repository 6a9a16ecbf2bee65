package com.xammer.insights.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    // Used for next-peak predictions and alert timestamps
    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }
}
