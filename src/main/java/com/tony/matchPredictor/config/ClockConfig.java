package com.tony.matchPredictor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Source de temps unique (TTL du cache, fraîcheur des cotes, journées de calibration)
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
