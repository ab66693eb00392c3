package com.monitoralert.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

/**
 * A rendered action handed off for delivery. Keyed by alert id on the topic.
 */
@Builder(toBuilder = true)
public record ActionNotification(
        @JsonProperty("alert_id") String alertId,
        @JsonProperty("monitor_id") String monitorId,
        @JsonProperty("monitor_name") String monitorName,
        @JsonProperty("trigger_id") String triggerId,
        @JsonProperty("trigger_name") String triggerName,
        String severity,
        @JsonProperty("action_id") String actionId,
        @JsonProperty("action_name") String actionName,
        @JsonProperty("destination_id") String destinationId,
        String subject,
        String message,
        @JsonProperty("created_at") Instant createdAt) {}
