package com.monitoralert.common.lifecycle;

import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertHistoryEntry;
import com.monitoralert.common.model.AlertState;
import com.monitoralert.common.model.Monitor;
import com.monitoralert.common.model.Trigger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * State machine over {@link Alert#state()}. Every method maps one snapshot to the next and
 * never touches storage; callers persist the result with the snapshot's version.
 *
 * <pre>
 * (none)                     -> ACTIVE        condition true
 * ACTIVE | ERROR             -> ACTIVE        condition true
 * ACKNOWLEDGED               -> ACKNOWLEDGED  condition true, actions suppressed
 * ACTIVE | ACKNOWLEDGED | ERROR -> COMPLETED  condition false
 * ACTIVE | COMPLETED         -> ACKNOWLEDGED  acknowledge request
 * any but DELETED            -> ERROR         condition or input failed
 * any but DELETED            -> DELETED       retention
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class AlertLifecycleTracker {

    private final IdGenerator idGenerator;

    public Alert open(Monitor monitor, Trigger trigger, Instant now) {
        return newAlert(monitor, trigger, AlertState.ACTIVE, now).build();
    }

    /**
     * Records a failed evaluation. A missing current alert yields a new ERROR alert so the
     * failure is visible.
     */
    public Alert fail(Alert current, Monitor monitor, Trigger trigger, String message, Instant now) {
        if (current == null) {
            return newAlert(monitor, trigger, AlertState.ERROR, now)
                    .errorMessage(message)
                    .alertHistory(List.of(new AlertHistoryEntry(now, message)))
                    .build();
        }
        requireMutable(current);
        return withMonitor(current, monitor, trigger).toBuilder()
                .state(AlertState.ERROR)
                .errorMessage(message)
                .build()
                .withHistory(new AlertHistoryEntry(now, message));
    }

    /**
     * Applies one cycle in which the trigger condition held.
     *
     * @param results  the action execution results computed for this cycle
     * @param failures action failures to surface in the alert history
     * @param notified whether at least one action ran successfully
     */
    public Alert applyCycle(
            Alert current,
            Map<String, ActionExecutionResult> results,
            List<AlertHistoryEntry> failures,
            boolean notified,
            Monitor monitor,
            Trigger trigger,
            Instant now) {
        if (!current.isCurrent()) {
            throw new IllegalStateException("Alert " + current.id() + " is not current: " + current.state());
        }
        var history = new ArrayList<>(current.alertHistory());
        var builder = withMonitor(current, monitor, trigger).toBuilder();
        if (current.state() == AlertState.ERROR) {
            builder.state(AlertState.ACTIVE).errorMessage(null);
            log.info("alert.recovered: alert_id={}, monitor_id={}", current.id(), current.monitorId());
        }
        if (current.state() != AlertState.ACKNOWLEDGED) {
            builder.actionExecutionResults(results);
            history.addAll(failures);
            if (notified) {
                builder.lastNotificationTime(now);
            }
        }
        return builder.alertHistory(history).build();
    }

    public Alert complete(Alert current, Instant now) {
        if (!current.isCurrent()) {
            throw new IllegalStateException("Alert " + current.id() + " is not current: " + current.state());
        }
        var completed = current.toBuilder()
                .state(AlertState.COMPLETED)
                .endTime(now)
                .errorMessage(null)
                .build();
        if (current.errorMessage() != null) {
            completed = completed.withHistory(new AlertHistoryEntry(now, current.errorMessage()));
        }
        return completed;
    }

    /**
     * Classifies an acknowledge batch for one monitor. Ids that are unknown, belong to
     * another monitor, or are in ERROR or DELETED state fail without aborting the batch.
     * Already acknowledged alerts succeed unchanged.
     *
     * @param found the alerts that exist, keyed by id
     */
    public AcknowledgeOutcome acknowledge(
            String monitorId, List<String> alertIds, Map<String, Alert> found, Instant now) {
        var toPersist = new ArrayList<Alert>();
        var succeeded = new ArrayList<String>();
        var failed = new ArrayList<String>();
        for (var alertId : new LinkedHashSet<>(alertIds)) {
            var alert = found.get(alertId);
            if (alert == null || !monitorId.equals(alert.monitorId())) {
                failed.add(alertId);
                continue;
            }
            switch (alert.state()) {
                case ACTIVE, COMPLETED -> {
                    toPersist.add(alert.toBuilder()
                            .state(AlertState.ACKNOWLEDGED)
                            .acknowledgedTime(now)
                            .build());
                    succeeded.add(alertId);
                }
                case ACKNOWLEDGED -> succeeded.add(alertId);
                case ERROR, DELETED -> failed.add(alertId);
            }
        }
        return new AcknowledgeOutcome(toPersist, succeeded, failed);
    }

    public Alert delete(Alert current, Instant now) {
        requireMutable(current);
        return current.toBuilder()
                .state(AlertState.DELETED)
                .endTime(current.endTime() == null ? now : current.endTime())
                .build();
    }

    public boolean actionsSuppressed(Alert alert) {
        return alert != null && alert.state() == AlertState.ACKNOWLEDGED;
    }

    private Alert.AlertBuilder newAlert(Monitor monitor, Trigger trigger, AlertState state, Instant now) {
        return Alert.builder()
                .id(idGenerator.generate())
                .version(Alert.UNSAVED_VERSION)
                .monitorId(monitor.id())
                .monitorVersion(monitor.version())
                .monitorName(monitor.name())
                .monitorUser(monitor.user())
                .triggerId(trigger.id())
                .triggerName(trigger.name())
                .severity(trigger.severity())
                .state(state)
                .actionExecutionResults(Map.of())
                .startTime(now);
    }

    private static Alert withMonitor(Alert alert, Monitor monitor, Trigger trigger) {
        return alert.toBuilder()
                .monitorVersion(monitor.version())
                .monitorName(monitor.name())
                .monitorUser(monitor.user())
                .triggerName(trigger.name())
                .severity(trigger.severity())
                .build();
    }

    private static void requireMutable(Alert alert) {
        if (alert.state() == AlertState.DELETED) {
            throw new IllegalStateException("Alert " + alert.id() + " is deleted");
        }
    }
}
