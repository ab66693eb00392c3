package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.exceptions.EvaluationException;
import com.monitoralert.common.exceptions.VersionConflictException;
import com.monitoralert.common.lifecycle.AlertLifecycleTracker;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.Monitor;
import com.monitoralert.common.model.Trigger;
import com.monitoralert.evaluator.domain.alert.AlertStore;
import com.monitoralert.evaluator.domain.ledger.ActionExecutionLedger;
import com.monitoralert.evaluator.domain.ledger.ActionOutcome;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one evaluation cycle of one monitor: search, then each trigger in order.
 *
 * <p>Alert writes carry the version they were computed from. On a version conflict the
 * current alert is reloaded and the same transition is applied to it again; actions are
 * never dispatched a second time for the same cycle. A stored alert that is no longer
 * current after the conflict is left alone.
 */
@Slf4j
@RequiredArgsConstructor
public class MonitorRunner {

    private final SearchPort searchPort;
    private final TriggerConditionEvaluator conditionEvaluator;
    private final ActionExecutionLedger ledger;
    private final AlertLifecycleTracker tracker;
    private final ActionDispatcher dispatcher;
    private final AlertStore alertStore;
    private final int maxPersistRetries;

    public MonitorRunResult run(Monitor monitor, Instant periodStart, Instant periodEnd) {
        List<Map<String, Object>> results = List.of();
        Exception inputError = null;
        try {
            if (!monitor.input().isEmpty()) {
                results = List.of(searchPort.query(monitor.input()));
            }
        } catch (RuntimeException e) {
            log.warn("monitor.input_failed: monitor_id={}, reason={}", monitor.id(), e.getMessage());
            inputError = e;
        }

        var currentAlerts = alertStore.findCurrentAlerts(monitor.id());
        var triggerResults = new ArrayList<TriggerRunResult>();
        for (var trigger : monitor.triggers()) {
            var context = new TriggerExecutionContext(
                    monitor, trigger, results, periodStart, periodEnd, currentAlerts.get(trigger.id()), inputError);
            triggerResults.add(runTrigger(context, periodEnd));
        }
        return new MonitorRunResult(
                monitor.id(),
                periodStart,
                periodEnd,
                inputError == null ? null : inputError.getMessage(),
                triggerResults);
    }

    private TriggerRunResult runTrigger(TriggerExecutionContext context, Instant now) {
        var monitor = context.monitor();
        var trigger = context.trigger();
        var current = context.alert();

        if (context.error() != null) {
            var message = "Failed running monitor input: " + context.error().getMessage();
            var persisted = persistWithRetry(monitor, trigger, current,
                    alert -> tracker.fail(alert, monitor, trigger, message, now));
            return TriggerRunResult.failed(trigger.id(), message, persisted);
        }

        boolean triggered;
        try {
            triggered = conditionEvaluator.evaluate(trigger.condition(), context);
        } catch (EvaluationException e) {
            log.warn("trigger.evaluation_failed: monitor_id={}, trigger_id={}, reason={}",
                    monitor.id(), trigger.id(), e.getMessage());
            var persisted = persistWithRetry(monitor, trigger, current,
                    alert -> tracker.fail(alert, monitor, trigger, e.getMessage(), now));
            return TriggerRunResult.failed(trigger.id(), e.getMessage(), persisted);
        }

        if (!triggered) {
            Alert persisted = null;
            if (current != null) {
                persisted = persistWithRetry(monitor, trigger, current, alert -> tracker.complete(alert, now));
                if (persisted != null) {
                    log.info("alert.completed: alert_id={}, monitor_id={}, trigger_id={}",
                            persisted.id(), monitor.id(), trigger.id());
                }
            }
            return new TriggerRunResult(trigger.id(), false, null, List.of(), 0, persisted);
        }

        var alert = current != null ? current : tracker.open(monitor, trigger, now);
        if (current == null) {
            log.info("alert.opened: alert_id={}, monitor_id={}, trigger_id={}", alert.id(), monitor.id(), trigger.id());
        }
        var plan = ledger.plan(alert, trigger.actions(), tracker.actionsSuppressed(alert), now);
        var outcomes = dispatcher.dispatch(context.withAlert(alert), plan.toRun(), now);
        var outcomesById = new LinkedHashMap<String, ActionOutcome>();
        outcomes.forEach(outcome -> outcomesById.put(outcome.actionId(), outcome));

        var persisted = persistWithRetry(monitor, trigger, alert, snapshot -> {
            var update = ledger.record(snapshot, plan, outcomesById, now);
            return tracker.applyCycle(
                    snapshot, update.results(), update.failures(), update.notified(), monitor, trigger, now);
        });
        return new TriggerRunResult(trigger.id(), true, null, outcomes, plan.throttled().size(), persisted);
    }

    private Alert persistWithRetry(Monitor monitor, Trigger trigger, Alert snapshot, UnaryOperator<Alert> transition) {
        VersionConflictException lastConflict = null;
        var base = snapshot;
        for (int attempt = 0; attempt <= maxPersistRetries; attempt++) {
            var next = transition.apply(base);
            try {
                return alertStore.persist(next, next.version());
            } catch (VersionConflictException e) {
                lastConflict = e;
                log.warn("alert.version_conflict: alert_id={}, monitor_id={}, trigger_id={}, attempt={}",
                        next.id(), monitor.id(), trigger.id(), attempt + 1);
                base = alertStore.findCurrentAlert(monitor.id(), trigger.id()).orElse(null);
                if (base == null && snapshot != null && !snapshot.isUnsaved()) {
                    // ended elsewhere, for example tombstoned with its monitor; never reopen it
                    log.warn("alert.retry_abandoned: alert_id={}, monitor_id={}, trigger_id={}",
                            next.id(), monitor.id(), trigger.id());
                    return null;
                }
                if (base == null) {
                    base = snapshot;
                }
            }
        }
        throw lastConflict;
    }
}
