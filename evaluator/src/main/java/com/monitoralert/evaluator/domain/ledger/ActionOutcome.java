package com.monitoralert.evaluator.domain.ledger;

/**
 * What the dispatcher reported for one action that was run.
 */
public record ActionOutcome(String actionId, String actionName, boolean success, String error) {

    public static ActionOutcome success(String actionId, String actionName) {
        return new ActionOutcome(actionId, actionName, true, null);
    }

    public static ActionOutcome failure(String actionId, String actionName, String error) {
        return new ActionOutcome(actionId, actionName, false, error);
    }
}
