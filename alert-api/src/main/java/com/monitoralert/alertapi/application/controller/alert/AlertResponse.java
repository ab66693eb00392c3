package com.monitoralert.alertapi.application.controller.alert;

import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.AlertHistoryEntry;
import com.monitoralert.common.model.AlertState;
import java.time.Instant;
import java.util.List;

public record AlertResponse(
        String id,
        long version,
        String monitorId,
        long monitorVersion,
        String monitorName,
        String triggerId,
        String triggerName,
        String severity,
        AlertState state,
        String errorMessage,
        List<AlertHistoryEntry> alertHistory,
        List<ActionExecutionResult> actionExecutionResults,
        Instant startTime,
        Instant lastNotificationTime,
        Instant endTime,
        Instant acknowledgedTime) {}
