package com.monitoralert.evaluator.domain.ledger;

import com.monitoralert.common.model.ActionDefinition;

public record PlannedAction(ActionDefinition action, ActionDecision decision) {

    public String actionId() {
        return action.id();
    }
}
