package com.monitoralert.evaluator.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "evaluator")
public record EvaluatorProperties(
        @NotNull @Valid Workers workers,
        @NotNull @Valid Actions actions,
        @NotNull @Valid Persist persist,
        @NotNull @Valid Search search) {

    public record Workers(@Min(1) int monitorPoolSize, @Min(1) int actionPoolSize, @Min(0) int queueCapacity) {}

    public record Actions(@NotNull Duration timeout) {}

    public record Persist(@Min(0) int maxRetries) {}

    public record Search(@NotBlank String baseUrl) {}
}
