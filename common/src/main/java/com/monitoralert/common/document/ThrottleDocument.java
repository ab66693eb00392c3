package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.monitoralert.common.model.ThrottlePolicy;
import com.monitoralert.common.model.ThrottleUnit;

/**
 * Throttle as written in an action. The unit defaults to minutes.
 */
public record ThrottleDocument(Integer value, String unit) {

    static ThrottleDocument from(ThrottlePolicy throttle) {
        return throttle == null ? null : new ThrottleDocument(throttle.value(), throttle.unit().name());
    }

    ThrottlePolicy toThrottle() {
        var parsedUnit = unit == null ? ThrottleUnit.MINUTES : ThrottleUnit.parse(unit);
        return new ThrottlePolicy(required(value, "value", "throttle"), parsedUnit);
    }
}
