package com.monitoralert.alertapi.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "alerting")
public record AlertingProperties(@NotNull @Valid Retention retention) {

    /**
     * @param completedAlerts how long finished alerts stay visible before they are tombstoned
     * @param cron            retention schedule, {@code -} disables it
     */
    public record Retention(@NotNull Duration completedAlerts, @NotBlank String cron) {}
}
