package com.monitoralert.common.persistence;

import com.monitoralert.common.model.ActionExecutionResult;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Conversions between the keyed form an alert holds and the list form stored in a column.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ActionExecutionResults {

    public static Map<String, ActionExecutionResult> byActionId(Collection<ActionExecutionResult> results) {
        var map = new LinkedHashMap<String, ActionExecutionResult>();
        if (results != null) {
            results.forEach(result -> map.put(result.actionId(), result));
        }
        return map;
    }

    public static List<ActionExecutionResult> asList(Map<String, ActionExecutionResult> results) {
        return results == null ? List.of() : List.copyOf(results.values());
    }
}
