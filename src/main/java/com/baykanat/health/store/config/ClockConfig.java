package com.baykanat.health.store.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/** Partition varsayılan tarihi ve processed_at damgası için Clock bean'i. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(AppProperties appProperties) {
        String zone = appProperties.getTimeZone();
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone));
    }
}
