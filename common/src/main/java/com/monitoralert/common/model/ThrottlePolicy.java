package com.monitoralert.common.model;

import com.monitoralert.common.codec.RecordInput;
import com.monitoralert.common.codec.RecordOutput;
import com.monitoralert.common.codec.Writeable;
import com.monitoralert.common.exceptions.InvalidConfigException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooldown window applied to one action.
 */
public record ThrottlePolicy(int value, ThrottleUnit unit) implements Writeable {

    public ThrottlePolicy {
        if (unit == null) {
            throw InvalidConfigException.of("Throttle unit is required");
        }
        if (value <= 0) {
            throw InvalidConfigException.of("Can only set positive throttle period, got: " + value);
        }
    }

    public static ThrottlePolicy ofMinutes(int value) {
        return new ThrottlePolicy(value, ThrottleUnit.MINUTES);
    }

    public Duration toDuration() {
        return unit.toDuration(value);
    }

    /**
     * @param lastExecutionTime last successful run of the action, or null if it never ran
     * @return true while {@code now} is still inside the cooldown window
     */
    public boolean shouldThrottle(Instant lastExecutionTime, Instant now) {
        if (lastExecutionTime == null) {
            return false;
        }
        return Duration.between(lastExecutionTime, now).compareTo(toDuration()) < 0;
    }

    @Override
    public void writeTo(RecordOutput out) throws IOException {
        out.writeInt(value);
        out.writeEnum(unit);
    }

    public static ThrottlePolicy readFrom(RecordInput in) throws IOException {
        int value = in.readInt();
        return new ThrottlePolicy(value, ThrottleUnit.parse(in.readString()));
    }
}
