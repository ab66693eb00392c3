package com.monitoralert.common.model;

import com.monitoralert.common.exceptions.InvalidConfigException;
import java.time.Duration;

public enum ThrottleUnit {
    MINUTES;

    public Duration toDuration(int value) {
        return switch (this) {
            case MINUTES -> Duration.ofMinutes(value);
        };
    }

    public static ThrottleUnit parse(String name) {
        for (var unit : values()) {
            if (unit.name().equals(name)) {
                return unit;
            }
        }
        throw InvalidConfigException.of("Only support MINUTES throttle unit, got: " + name);
    }
}
