package com.monitoralert.evaluator.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter monitorsEvaluatedCounter(MeterRegistry registry) {
        return Counter.builder("evaluator.monitors.evaluated")
                .description("Total monitor evaluation cycles completed")
                .register(registry);
    }

    @Bean
    public Counter monitorsFailedCounter(MeterRegistry registry) {
        return Counter.builder("evaluator.monitors.failed")
                .description("Total monitor evaluation cycles that failed")
                .register(registry);
    }

    @Bean
    public Counter actionsExecutedCounter(MeterRegistry registry) {
        return Counter.builder("evaluator.actions.executed")
                .description("Total actions dispatched successfully")
                .register(registry);
    }

    @Bean
    public Counter actionsThrottledCounter(MeterRegistry registry) {
        return Counter.builder("evaluator.actions.throttled")
                .description("Total actions skipped by their throttle")
                .register(registry);
    }

    @Bean
    public Counter actionsFailedCounter(MeterRegistry registry) {
        return Counter.builder("evaluator.actions.failed")
                .description("Total actions whose dispatch failed or timed out")
                .register(registry);
    }
}
