package com.monitoralert.evaluator.application.job;

import com.monitoralert.common.model.Monitor;
import com.monitoralert.evaluator.domain.execution.MonitorRunResult;
import com.monitoralert.evaluator.domain.execution.MonitorRunner;
import com.monitoralert.evaluator.domain.monitor.MonitorSource;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduling round: evaluates every enabled monitor whose interval has elapsed, in parallel
 * on the monitor pool, and waits for the round to finish.
 *
 * A monitor still running from an earlier round is skipped, so at most one cycle per
 * monitor writes its alerts at a time. A failing monitor is logged and counted; it never
 * stops the others and is retried next round.
 */
@Slf4j
@Component
public class MonitorScheduler {

    private final MonitorSource monitorSource;
    private final MonitorRunner monitorRunner;
    private final Executor monitorExecutor;
    private final Clock clock;
    private final Counter monitorsEvaluatedCounter;
    private final Counter monitorsFailedCounter;
    private final Counter actionsExecutedCounter;
    private final Counter actionsThrottledCounter;
    private final Counter actionsFailedCounter;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<String, Instant> lastRuns = new ConcurrentHashMap<>();

    public MonitorScheduler(
            MonitorSource monitorSource,
            MonitorRunner monitorRunner,
            @Qualifier("monitorExecutor") Executor monitorExecutor,
            Clock clock,
            Counter monitorsEvaluatedCounter,
            Counter monitorsFailedCounter,
            Counter actionsExecutedCounter,
            Counter actionsThrottledCounter,
            Counter actionsFailedCounter) {
        this.monitorSource = monitorSource;
        this.monitorRunner = monitorRunner;
        this.monitorExecutor = monitorExecutor;
        this.clock = clock;
        this.monitorsEvaluatedCounter = monitorsEvaluatedCounter;
        this.monitorsFailedCounter = monitorsFailedCounter;
        this.actionsExecutedCounter = actionsExecutedCounter;
        this.actionsThrottledCounter = actionsThrottledCounter;
        this.actionsFailedCounter = actionsFailedCounter;
    }

    @Scheduled(
            fixedDelayString = "${evaluator.schedule.fixed-delay}",
            initialDelayString = "${evaluator.schedule.initial-delay}")
    public void runRound() {
        evaluateDue(clock.instant());
    }

    /**
     * @return number of monitors evaluated in this round
     */
    public int evaluateDue(Instant now) {
        List<Monitor> monitors;
        try {
            monitors = monitorSource.findEnabledMonitors();
        } catch (RuntimeException e) {
            log.error("Scheduling round aborted: failed to load monitors", e);
            return 0;
        }
        lastRuns.keySet().retainAll(monitors.stream().map(Monitor::id).collect(Collectors.toSet()));

        var futures = new ArrayList<CompletableFuture<Void>>();
        for (var monitor : monitors) {
            if (!isDue(monitor, now)) {
                continue;
            }
            if (!inFlight.add(monitor.id())) {
                log.debug("Monitor {} still running from a previous round, skipping", monitor.id());
                continue;
            }
            futures.add(CompletableFuture.runAsync(() -> evaluate(monitor, now), monitorExecutor)
                    .whenComplete((ignored, ex) -> inFlight.remove(monitor.id())));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        if (!futures.isEmpty()) {
            log.info("Scheduling round complete: {} of {} monitors evaluated", futures.size(), monitors.size());
        }
        return futures.size();
    }

    private boolean isDue(Monitor monitor, Instant now) {
        var lastRun = lastRuns.get(monitor.id());
        return lastRun == null || Duration.between(lastRun, now).compareTo(monitor.interval()) >= 0;
    }

    private void evaluate(Monitor monitor, Instant now) {
        var periodStart = lastRuns.getOrDefault(monitor.id(), now.minus(monitor.interval()));
        try {
            var result = monitorRunner.run(monitor, periodStart, now);
            lastRuns.put(monitor.id(), now);
            record(result);
        } catch (RuntimeException e) {
            monitorsFailedCounter.increment();
            log.error("monitor.failed: monitor_id={}", monitor.id(), e);
        }
    }

    private void record(MonitorRunResult result) {
        monitorsEvaluatedCounter.increment();
        actionsExecutedCounter.increment(result.executedActions());
        actionsThrottledCounter.increment(result.throttledActions());
        actionsFailedCounter.increment(result.failedActions());
        if (result.hasErrors()) {
            log.warn("monitor.evaluated_with_errors: monitor_id={}, input_error={}",
                    result.monitorId(), result.inputError());
        } else {
            log.debug("monitor.evaluated: monitor_id={}, executed={}, throttled={}",
                    result.monitorId(), result.executedActions(), result.throttledActions());
        }
    }
}
