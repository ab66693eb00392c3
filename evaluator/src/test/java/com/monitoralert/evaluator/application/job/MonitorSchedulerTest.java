package com.monitoralert.evaluator.application.job;

import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.T0;
import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.monitorBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

import com.monitoralert.common.model.Monitor;
import com.monitoralert.evaluator.domain.execution.MonitorRunResult;
import com.monitoralert.evaluator.domain.execution.MonitorRunner;
import com.monitoralert.evaluator.domain.execution.TriggerRunResult;
import com.monitoralert.evaluator.domain.ledger.ActionOutcome;
import com.monitoralert.evaluator.domain.monitor.MonitorSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MonitorSchedulerTest {

    @Mock
    MonitorSource monitorSource;

    @Mock
    MonitorRunner monitorRunner;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private MonitorScheduler scheduler;

    private final Monitor healthy = monitorBuilder().id("mon_healthy").build();
    private final Monitor broken = monitorBuilder().id("mon_broken").build();

    @BeforeEach
    void setUp() {
        scheduler = new MonitorScheduler(
                monitorSource,
                monitorRunner,
                Runnable::run,
                Clock.fixed(T0, ZoneOffset.UTC),
                registry.counter("monitors.evaluated"),
                registry.counter("monitors.failed"),
                registry.counter("actions.executed"),
                registry.counter("actions.throttled"),
                registry.counter("actions.failed"));
    }

    @Test
    void shouldIsolateFailingMonitorAndCountOutcomes() {
        // given
        given(monitorSource.findEnabledMonitors()).willReturn(List.of(broken, healthy));
        given(monitorRunner.run(eq(broken), any(), any())).willThrow(new IllegalStateException("db down"));
        given(monitorRunner.run(eq(healthy), any(), any())).willReturn(result(healthy, T0));

        // when
        var evaluated = scheduler.evaluateDue(T0);

        // then
        assertThat(evaluated).isEqualTo(2);
        assertThat(registry.counter("monitors.evaluated").count()).isEqualTo(1.0);
        assertThat(registry.counter("monitors.failed").count()).isEqualTo(1.0);
        assertThat(registry.counter("actions.executed").count()).isEqualTo(1.0);
        assertThat(registry.counter("actions.failed").count()).isEqualTo(1.0);
        assertThat(registry.counter("actions.throttled").count()).isEqualTo(2.0);
    }

    @Test
    void shouldSkipMonitorWhoseIntervalHasNotElapsed() {
        // given
        given(monitorSource.findEnabledMonitors()).willReturn(List.of(healthy));
        given(monitorRunner.run(eq(healthy), any(), any())).willReturn(result(healthy, T0));
        scheduler.evaluateDue(T0);

        // when
        var evaluated = scheduler.evaluateDue(T0.plusSeconds(30));

        // then
        assertThat(evaluated).isZero();
        then(monitorRunner).should().run(eq(healthy), any(), any());
    }

    @Test
    void shouldStartNextPeriodWhereThePreviousOneEnded() {
        // given
        var later = T0.plusSeconds(90);
        given(monitorSource.findEnabledMonitors()).willReturn(List.of(healthy));
        given(monitorRunner.run(eq(healthy), any(), any())).willReturn(result(healthy, T0));
        scheduler.evaluateDue(T0);

        // when
        scheduler.evaluateDue(later);

        // then
        then(monitorRunner).should().run(healthy, T0.minus(healthy.interval()), T0);
        then(monitorRunner).should().run(healthy, T0, later);
    }

    @Test
    void shouldRetryFailedMonitorNextRound() {
        // given
        given(monitorSource.findEnabledMonitors()).willReturn(List.of(broken));
        given(monitorRunner.run(eq(broken), any(), any())).willThrow(new IllegalStateException("db down"));
        scheduler.evaluateDue(T0);

        // when
        var evaluated = scheduler.evaluateDue(T0.plusSeconds(10));

        // then
        assertThat(evaluated).isEqualTo(1);
        assertThat(registry.counter("monitors.failed").count()).isEqualTo(2.0);
    }

    @Test
    void shouldSkipRoundWhenMonitorsCannotBeLoaded() {
        // given
        given(monitorSource.findEnabledMonitors()).willThrow(new IllegalStateException("db down"));

        // when
        var evaluated = scheduler.evaluateDue(T0);

        // then
        assertThat(evaluated).isZero();
        then(monitorRunner).should(never()).run(any(), any(), any());
    }

    private static MonitorRunResult result(Monitor monitor, Instant now) {
        var trigger = new TriggerRunResult(
                "trg_test_001",
                true,
                null,
                List.of(ActionOutcome.success("act_1", "page"), ActionOutcome.failure("act_2", "chat", "timeout")),
                2,
                null);
        return new MonitorRunResult(monitor.id(), now.minus(monitor.interval()), now, null, List.of(trigger));
    }
}
