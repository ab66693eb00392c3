package com.monitoralert.evaluator.domain.ledger;

public enum ActionDecision {
    RUN,
    THROTTLED,
    /** Alert acknowledged: the action neither runs nor counts as a skip. */
    SUPPRESSED
}
