package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.monitoralert.common.model.ActionExecutionResult;
import java.time.Instant;

/**
 * Column form of one ledger entry; times are epoch milliseconds.
 */
public record ActionExecutionResultDocument(
        @JsonProperty("action_id") String actionId,
        @JsonProperty("last_execution_time") Long lastExecutionTime,
        @JsonProperty("throttled_count") Integer throttledCount) {

    static ActionExecutionResultDocument from(ActionExecutionResult result) {
        var last = result.lastExecutionTime();
        return new ActionExecutionResultDocument(
                result.actionId(), last == null ? null : last.toEpochMilli(), result.throttledCount());
    }

    ActionExecutionResult toResult() {
        return new ActionExecutionResult(
                required(actionId, "action_id", "action execution result"),
                lastExecutionTime == null ? null : Instant.ofEpochMilli(lastExecutionTime),
                throttledCount == null ? 0 : throttledCount);
    }
}
