package com.monitoralert.evaluator.test.fixtures;

import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertState;
import com.monitoralert.common.model.Monitor;
import com.monitoralert.common.model.Script;
import com.monitoralert.common.model.SearchInput;
import com.monitoralert.common.model.ThrottlePolicy;
import com.monitoralert.common.model.Trigger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class EvaluatorFixtures {

    public static final String SOME_MONITOR_ID = "mon_test_001";
    public static final String SOME_TRIGGER_ID = "trg_test_001";
    public static final String SOME_ACTION_ID = "act_test_001";
    public static final String SOME_OTHER_ACTION_ID = "act_test_002";
    public static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    public static IdGenerator sequentialIds(String prefix) {
        var counter = new AtomicInteger();
        return () -> prefix + counter.incrementAndGet();
    }

    public static ActionDefinition.ActionDefinitionBuilder actionBuilder() {
        return ActionDefinition.builder()
                .id(SOME_ACTION_ID)
                .name("page on-call")
                .destinationId("dest_pagerduty")
                .subjectTemplate(Script.mustache("subject"))
                .messageTemplate(Script.mustache("message"))
                .throttleEnabled(true)
                .throttle(ThrottlePolicy.ofMinutes(5));
    }

    public static ActionDefinition unthrottledAction() {
        return actionBuilder()
                .id(SOME_OTHER_ACTION_ID)
                .name("post to chat")
                .throttleEnabled(false)
                .throttle(null)
                .build();
    }

    public static Trigger.TriggerBuilder triggerBuilder() {
        return Trigger.builder()
                .id(SOME_TRIGGER_ID)
                .name("error rate high")
                .severity("1")
                .condition(Script.spel("#hitCount > 0"))
                .actions(List.of(actionBuilder().build()));
    }

    public static Monitor.MonitorBuilder monitorBuilder() {
        return Monitor.builder()
                .id(SOME_MONITOR_ID)
                .version(1L)
                .name("checkout errors")
                .enabled(true)
                .intervalMinutes(1)
                .input(new SearchInput(List.of("logs-*"), Map.of("size", 0)))
                .triggers(List.of(triggerBuilder().build()));
    }

    public static Alert.AlertBuilder activeAlertBuilder() {
        return Alert.builder()
                .id("alt_existing")
                .version(4L)
                .monitorId(SOME_MONITOR_ID)
                .monitorVersion(1L)
                .monitorName("checkout errors")
                .triggerId(SOME_TRIGGER_ID)
                .triggerName("error rate high")
                .severity("1")
                .state(AlertState.ACTIVE)
                .startTime(T0);
    }
}
