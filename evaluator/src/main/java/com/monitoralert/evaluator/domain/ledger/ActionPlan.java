package com.monitoralert.evaluator.domain.ledger;

import com.monitoralert.common.model.ActionDefinition;
import java.util.List;

/**
 * Disjoint partition of a trigger's actions for one cycle, in trigger order.
 */
public record ActionPlan(List<PlannedAction> actions) {

    public ActionPlan {
        actions = List.copyOf(actions);
    }

    public List<ActionDefinition> toRun() {
        return withDecision(ActionDecision.RUN);
    }

    public List<ActionDefinition> throttled() {
        return withDecision(ActionDecision.THROTTLED);
    }

    public List<ActionDefinition> suppressed() {
        return withDecision(ActionDecision.SUPPRESSED);
    }

    private List<ActionDefinition> withDecision(ActionDecision decision) {
        return actions.stream()
                .filter(planned -> planned.decision() == decision)
                .map(PlannedAction::action)
                .toList();
    }
}
