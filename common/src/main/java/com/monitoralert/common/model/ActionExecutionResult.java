package com.monitoralert.common.model;

import com.monitoralert.common.codec.RecordInput;
import com.monitoralert.common.codec.RecordOutput;
import com.monitoralert.common.codec.Writeable;
import java.io.IOException;
import java.time.Instant;

/**
 * Per-action ledger entry of one alert: when the action last ran and how many cycles it
 * has been skipped by its throttle since the alert began.
 */
public record ActionExecutionResult(String actionId, Instant lastExecutionTime, int throttledCount)
        implements Writeable {

    public ActionExecutionResult {
        if (actionId == null) {
            throw new IllegalArgumentException("actionId is required");
        }
    }

    public static ActionExecutionResult initial(String actionId) {
        return new ActionExecutionResult(actionId, null, 0);
    }

    public ActionExecutionResult executedAt(Instant time) {
        return new ActionExecutionResult(actionId, time, throttledCount);
    }

    /**
     * Saturates at {@link Integer#MAX_VALUE}. Negative counts left over from older records
     * restart from zero.
     */
    public ActionExecutionResult throttledOnce() {
        int base = Math.max(throttledCount, 0);
        int next = base == Integer.MAX_VALUE ? base : base + 1;
        return new ActionExecutionResult(actionId, lastExecutionTime, next);
    }

    @Override
    public void writeTo(RecordOutput out) throws IOException {
        out.writeString(actionId);
        out.writeBoolean(lastExecutionTime != null);
        if (lastExecutionTime != null) {
            out.writeLong(lastExecutionTime.toEpochMilli());
        }
        out.writeInt(throttledCount);
    }

    public static ActionExecutionResult readFrom(RecordInput in) throws IOException {
        var actionId = in.readString();
        var lastExecutionTime = in.readBoolean() ? Instant.ofEpochMilli(in.readLong()) : null;
        return new ActionExecutionResult(actionId, lastExecutionTime, in.readInt());
    }
}
