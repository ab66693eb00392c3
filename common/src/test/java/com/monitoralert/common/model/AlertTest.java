package com.monitoralert.common.model;

import static com.monitoralert.common.test.fixtures.MonitorFixtures.SOME_TIME;
import static com.monitoralert.common.test.fixtures.MonitorFixtures.activeAlertBuilder;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AlertTest {

    @Test
    void historyKeepsOnlyTheMostRecentEntries() {
        var history = new ArrayList<AlertHistoryEntry>();
        for (int i = 0; i < 15; i++) {
            history.add(new AlertHistoryEntry(SOME_TIME.plusSeconds(i), "failure " + i));
        }

        var alert = activeAlertBuilder().alertHistory(history).build();

        assertThat(alert.alertHistory()).hasSize(Alert.MAX_HISTORY);
        assertThat(alert.alertHistory().get(0).message()).isEqualTo("failure 5");
        assertThat(alert.alertHistory().get(9).message()).isEqualTo("failure 14");
    }

    @Test
    void currentMeansOpenStateWithoutEndTime() {
        assertThat(activeAlertBuilder().build().isCurrent()).isTrue();
        assertThat(activeAlertBuilder().state(AlertState.ERROR).build().isCurrent()).isTrue();
        assertThat(activeAlertBuilder().state(AlertState.COMPLETED).endTime(SOME_TIME).build().isCurrent()).isFalse();
        assertThat(activeAlertBuilder().state(AlertState.ACKNOWLEDGED).endTime(SOME_TIME).build().isCurrent())
                .isFalse();
    }

    @Test
    void resultForUnknownActionIsEmpty() {
        var result = activeAlertBuilder().actionExecutionResults(Map.of()).build().resultFor("act");

        assertThat(result.lastExecutionTime()).isNull();
        assertThat(result.throttledCount()).isZero();
    }

    @Test
    void templateArgumentUsesEpochMillis() {
        var arg = activeAlertBuilder().lastNotificationTime(SOME_TIME).build().asTemplateArg();

        assertThat(arg)
                .containsEntry("state", "ACTIVE")
                .containsEntry("last_notification_time", SOME_TIME.toEpochMilli())
                .containsEntry("end_time", null);
    }
}
