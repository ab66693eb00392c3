package com.monitoralert.alertapi.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter alertsAcknowledgedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.acknowledged")
                .description("Total alerts moved to ACKNOWLEDGED")
                .register(registry);
    }

    @Bean
    public Counter alertsDeletedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.deleted")
                .description("Total alerts tombstoned by monitor deletion or retention")
                .register(registry);
    }

    @Bean
    public Counter monitorsCreatedCounter(MeterRegistry registry) {
        return Counter.builder("monitors.created")
                .description("Total monitors created")
                .register(registry);
    }
}
