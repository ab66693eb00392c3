package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.Monitor;
import com.monitoralert.common.model.Trigger;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a trigger condition and an action template can see during one cycle.
 *
 * @param results one search response per monitor input, empty when the input failed
 * @param alert   the alert being updated, null before one exists
 * @param error   failure of the monitor input, null on success
 */
public record TriggerExecutionContext(
        Monitor monitor,
        Trigger trigger,
        List<Map<String, Object>> results,
        Instant periodStart,
        Instant periodEnd,
        Alert alert,
        Exception error
) {

    public TriggerExecutionContext {
        results = results == null ? List.of() : results;
    }

    public TriggerExecutionContext withAlert(Alert alert) {
        return new TriggerExecutionContext(monitor, trigger, results, periodStart, periodEnd, alert, error);
    }

    public Map<String, Object> asTemplateArg() {
        var arg = new HashMap<String, Object>();
        arg.put("monitor", monitor.asTemplateArg());
        arg.put("trigger", trigger.asTemplateArg());
        arg.put("results", results);
        arg.put("periodStart", periodStart);
        arg.put("periodEnd", periodEnd);
        arg.put("alert", alert == null ? null : alert.asTemplateArg());
        arg.put("error", error == null ? null : error.getMessage());
        return arg;
    }
}
