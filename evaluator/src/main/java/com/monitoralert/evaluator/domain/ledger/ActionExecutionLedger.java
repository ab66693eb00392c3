package com.monitoralert.evaluator.domain.ledger;

import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertHistoryEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-alert, per-action throttle bookkeeping. Stateless: both steps read an alert snapshot
 * and return values, the alert's result map is the only record of past executions.
 *
 * <p>Within one cycle each action is either run, throttled or suppressed. A throttled
 * action increments its skip count and keeps its last execution time. A run action that
 * succeeds moves its last execution time to {@code now}. A run action that fails changes
 * nothing in the map, so the next cycle tries it again.
 */
@Slf4j
@Component
public class ActionExecutionLedger {

    public ActionPlan plan(Alert alert, List<ActionDefinition> actions, boolean suppressed, Instant now) {
        var planned = new ArrayList<PlannedAction>(actions.size());
        for (var action : actions) {
            planned.add(new PlannedAction(action, decide(alert, action, suppressed, now)));
        }
        return new ActionPlan(planned);
    }

    /**
     * Applies a plan and the dispatcher's outcomes to {@code snapshot}. The snapshot may be
     * a newer version of the alert the plan was made for; counts are taken from it.
     *
     * @param outcomes outcomes of the actions planned to run, keyed by action id
     */
    public LedgerUpdate record(Alert snapshot, ActionPlan plan, Map<String, ActionOutcome> outcomes, Instant now) {
        var results = new LinkedHashMap<>(snapshot.actionExecutionResults());
        var failures = new ArrayList<AlertHistoryEntry>();
        boolean notified = false;

        for (var planned : plan.actions()) {
            var actionId = planned.actionId();
            switch (planned.decision()) {
                case SUPPRESSED -> log.debug("Action {} suppressed for acknowledged alert {}", actionId, snapshot.id());
                case THROTTLED -> results.put(actionId, snapshot.resultFor(actionId).throttledOnce());
                case RUN -> {
                    var outcome = outcomes.get(actionId);
                    if (outcome != null && outcome.success()) {
                        results.put(actionId, snapshot.resultFor(actionId).executedAt(now));
                        notified = true;
                    } else {
                        var error = outcome == null ? "no outcome reported" : outcome.error();
                        failures.add(new AlertHistoryEntry(
                                now, "Failed running action " + planned.action().name() + ": " + error));
                    }
                }
            }
        }
        return new LedgerUpdate(results, failures, notified);
    }

    private ActionDecision decide(Alert alert, ActionDefinition action, boolean suppressed, Instant now) {
        if (suppressed) {
            return ActionDecision.SUPPRESSED;
        }
        if (!action.throttleEnabled()) {
            return ActionDecision.RUN;
        }
        var previous = alert.resultFor(action.id());
        if (action.throttle().shouldThrottle(previous.lastExecutionTime(), now)) {
            log.debug("Action {} throttled: last_execution_time={}, throttled_count={}",
                    action.id(), previous.lastExecutionTime(), previous.throttledCount());
            return ActionDecision.THROTTLED;
        }
        return ActionDecision.RUN;
    }
}
