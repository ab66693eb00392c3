package com.monitoralert.evaluator.domain.execution;

import java.time.Instant;
import java.util.List;

public record MonitorRunResult(
        String monitorId,
        Instant periodStart,
        Instant periodEnd,
        String inputError,
        List<TriggerRunResult> triggerResults
) {

    public MonitorRunResult {
        triggerResults = List.copyOf(triggerResults);
    }

    public boolean hasErrors() {
        return inputError != null || triggerResults.stream().anyMatch(result -> result.error() != null);
    }

    public long executedActions() {
        return triggerResults.stream().mapToLong(TriggerRunResult::executedActions).sum();
    }

    public long failedActions() {
        return triggerResults.stream().mapToLong(TriggerRunResult::failedActions).sum();
    }

    public long throttledActions() {
        return triggerResults.stream().mapToLong(TriggerRunResult::throttledActions).sum();
    }
}
