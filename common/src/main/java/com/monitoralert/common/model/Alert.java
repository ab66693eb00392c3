package com.monitoralert.common.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;

/**
 * One alert of a (monitor, trigger) pair. Instances are snapshots: every transition
 * produces a new record via {@code toBuilder()}.
 */
@Builder(toBuilder = true)
public record Alert(
        String id,
        long version,
        String monitorId,
        long monitorVersion,
        String monitorName,
        String monitorUser,
        String triggerId,
        String triggerName,
        String severity,
        AlertState state,
        String errorMessage,
        List<AlertHistoryEntry> alertHistory,
        Map<String, ActionExecutionResult> actionExecutionResults,
        Instant startTime,
        Instant lastNotificationTime,
        Instant endTime,
        Instant acknowledgedTime
) {

    public static final long UNSAVED_VERSION = -1L;
    public static final int MAX_HISTORY = 10;

    private static final Set<AlertState> CURRENT_STATES =
            Set.of(AlertState.ACTIVE, AlertState.ACKNOWLEDGED, AlertState.ERROR);

    public Alert {
        alertHistory = trimHistory(alertHistory);
        actionExecutionResults = actionExecutionResults == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(actionExecutionResults));
    }

    public boolean isUnsaved() {
        return version == UNSAVED_VERSION;
    }

    public boolean isCurrent() {
        return CURRENT_STATES.contains(state) && endTime == null;
    }

    public ActionExecutionResult resultFor(String actionId) {
        return actionExecutionResults.getOrDefault(actionId, ActionExecutionResult.initial(actionId));
    }

    public Alert withHistory(AlertHistoryEntry entry) {
        var history = new ArrayList<>(alertHistory);
        history.add(entry);
        return toBuilder().alertHistory(history).build();
    }

    public Map<String, Object> asTemplateArg() {
        var arg = new HashMap<String, Object>();
        arg.put("id", id);
        arg.put("version", version);
        arg.put("state", state == null ? null : state.name());
        arg.put("severity", severity);
        arg.put("error_message", errorMessage);
        arg.put("start_time", toMillis(startTime));
        arg.put("last_notification_time", toMillis(lastNotificationTime));
        arg.put("end_time", toMillis(endTime));
        arg.put("acknowledged_time", toMillis(acknowledgedTime));
        return arg;
    }

    private static List<AlertHistoryEntry> trimHistory(List<AlertHistoryEntry> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, history.size() - MAX_HISTORY);
        return List.copyOf(history.subList(from, history.size()));
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
