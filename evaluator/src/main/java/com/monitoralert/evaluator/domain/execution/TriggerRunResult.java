package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.model.Alert;
import com.monitoralert.evaluator.domain.ledger.ActionOutcome;
import java.util.List;

/**
 * @param alert the alert as persisted by this cycle, null if none was written
 */
public record TriggerRunResult(
        String triggerId,
        boolean triggered,
        String error,
        List<ActionOutcome> outcomes,
        int throttledActions,
        Alert alert
) {

    public TriggerRunResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static TriggerRunResult failed(String triggerId, String error, Alert alert) {
        return new TriggerRunResult(triggerId, false, error, List.of(), 0, alert);
    }

    public long executedActions() {
        return outcomes.stream().filter(ActionOutcome::success).count();
    }

    public long failedActions() {
        return outcomes.stream().filter(outcome -> !outcome.success()).count();
    }
}
