package com.monitoralert.evaluator.domain.ledger;

import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.SOME_ACTION_ID;
import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.SOME_OTHER_ACTION_ID;
import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.T0;
import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.actionBuilder;
import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.activeAlertBuilder;
import static com.monitoralert.evaluator.test.fixtures.EvaluatorFixtures.unthrottledAction;
import static org.assertj.core.api.Assertions.assertThat;

import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.Alert;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ActionExecutionLedgerTest {

    private final ActionExecutionLedger ledger = new ActionExecutionLedger();

    @Test
    void actionThatNeverRanIsEligible() {
        var plan = ledger.plan(activeAlertBuilder().build(), List.of(actionBuilder().build()), false, T0);

        assertThat(plan.toRun()).extracting(ActionDefinition::id).containsExactly(SOME_ACTION_ID);
        assertThat(plan.throttled()).isEmpty();
    }

    @Test
    void unthrottledActionAlwaysRuns() {
        var alert = withResult(new ActionExecutionResult(SOME_OTHER_ACTION_ID, T0, 0));

        var plan = ledger.plan(alert, List.of(unthrottledAction()), false, T0.plusSeconds(1));

        assertThat(plan.toRun()).hasSize(1);
    }

    @Test
    void partitionFollowsTriggerOrder() {
        var alert = withResult(new ActionExecutionResult(SOME_ACTION_ID, T0, 0));
        var actions = List.of(unthrottledAction(), actionBuilder().build());

        var plan = ledger.plan(alert, actions, false, T0.plusSeconds(60));

        assertThat(plan.actions()).extracting(PlannedAction::decision)
                .containsExactly(ActionDecision.RUN, ActionDecision.THROTTLED);
    }

    @Test
    void repeatedThrottledCyclesIncrementByExactlyOneAndKeepExecutionTime() {
        var action = actionBuilder().build();
        Alert alert = withResult(new ActionExecutionResult(SOME_ACTION_ID, T0, 0));

        for (int cycle = 1; cycle <= 3; cycle++) {
            var now = T0.plusSeconds(30L * cycle);
            var plan = ledger.plan(alert, List.of(action), false, now);
            var update = ledger.record(alert, plan, Map.of(), now);
            alert = alert.toBuilder().actionExecutionResults(update.results()).build();

            assertThat(alert.resultFor(SOME_ACTION_ID).throttledCount()).isEqualTo(cycle);
            assertThat(alert.resultFor(SOME_ACTION_ID).lastExecutionTime()).isEqualTo(T0);
            assertThat(update.notified()).isFalse();
        }
    }

    @Test
    void successfulRunMovesExecutionTimeAndKeepsCount() {
        var alert = withResult(new ActionExecutionResult(SOME_ACTION_ID, T0, 2));
        var now = T0.plusSeconds(400);
        var plan = ledger.plan(alert, List.of(actionBuilder().build()), false, now);

        var update = ledger.record(alert, plan, Map.of(SOME_ACTION_ID, ActionOutcome.success(SOME_ACTION_ID, "page")), now);

        assertThat(update.results().get(SOME_ACTION_ID)).isEqualTo(new ActionExecutionResult(SOME_ACTION_ID, now, 2));
        assertThat(update.notified()).isTrue();
        assertThat(update.failures()).isEmpty();
    }

    @Test
    void failedRunAdvancesNothingAndIsNotASkip() {
        var alert = withResult(new ActionExecutionResult(SOME_ACTION_ID, T0, 2));
        var now = T0.plusSeconds(400);
        var plan = ledger.plan(alert, List.of(actionBuilder().build()), false, now);

        var update = ledger.record(alert, plan,
                Map.of(SOME_ACTION_ID, ActionOutcome.failure(SOME_ACTION_ID, "page", "timed out")), now);

        assertThat(update.results().get(SOME_ACTION_ID)).isEqualTo(new ActionExecutionResult(SOME_ACTION_ID, T0, 2));
        assertThat(update.notified()).isFalse();
        assertThat(update.failures()).singleElement()
                .satisfies(entry -> assertThat(entry.message()).contains("page on-call", "timed out"));

        var retry = ledger.plan(alert.toBuilder().actionExecutionResults(update.results()).build(),
                List.of(actionBuilder().build()), false, now.plusSeconds(1));
        assertThat(retry.toRun()).hasSize(1);
    }

    @Test
    void runWithoutReportedOutcomeIsAFailure() {
        var alert = activeAlertBuilder().build();
        var plan = ledger.plan(alert, List.of(unthrottledAction()), false, T0);

        var update = ledger.record(alert, plan, Map.of(), T0);

        assertThat(update.results()).doesNotContainKey(SOME_OTHER_ACTION_ID);
        assertThat(update.failures()).hasSize(1);
    }

    @Test
    void suppressedAlertMutatesNothing() {
        var existing = new ActionExecutionResult(SOME_ACTION_ID, T0, 1);
        var alert = withResult(existing);
        var now = T0.plusSeconds(30);

        var plan = ledger.plan(alert, List.of(actionBuilder().build(), unthrottledAction()), true, now);
        var update = ledger.record(alert, plan, Map.of(), now);

        assertThat(plan.toRun()).isEmpty();
        assertThat(plan.suppressed()).hasSize(2);
        assertThat(update.results()).containsExactly(Map.entry(SOME_ACTION_ID, existing));
        assertThat(update.failures()).isEmpty();
    }

    @Test
    void recordReadsCountsFromTheSnapshotItIsGiven() {
        var planned = withResult(new ActionExecutionResult(SOME_ACTION_ID, T0, 1));
        var newer = withResult(new ActionExecutionResult(SOME_ACTION_ID, T0, 5));
        var now = T0.plusSeconds(60);
        var plan = ledger.plan(planned, List.of(actionBuilder().build()), false, now);

        var update = ledger.record(newer, plan, Map.of(), now);

        assertThat(update.results().get(SOME_ACTION_ID).throttledCount()).isEqualTo(6);
    }

    @Test
    void cooldownBoundaryIsEligible() {
        var alert = withResult(new ActionExecutionResult(SOME_ACTION_ID, T0, 0));

        var plan = ledger.plan(alert, List.of(actionBuilder().build()), false, T0.plusSeconds(300));

        assertThat(plan.toRun()).hasSize(1);
    }

    private static Alert withResult(ActionExecutionResult result) {
        return activeAlertBuilder().actionExecutionResults(Map.of(result.actionId(), result)).build();
    }
}
