package com.monitoralert.alertapi.application.service;

import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.SOME_ALERT_ID;
import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.SOME_MONITOR_ID;
import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.SOME_OTHER_ALERT_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

import com.monitoralert.alertapi.domain.alert.AcknowledgeResult;
import com.monitoralert.alertapi.domain.alert.AlertService;
import com.monitoralert.common.lifecycle.AcknowledgeOutcome;
import com.monitoralert.common.transport.AcknowledgeAlertRequest;
import com.monitoralert.common.transport.RefreshPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AlertCommandHandlerTest {

    @Mock
    private AlertService alertService;

    private Counter alertsAcknowledgedCounter;
    private AlertCommandHandler handler;

    @BeforeEach
    void setUp() {
        alertsAcknowledgedCounter = new SimpleMeterRegistry().counter("alerts.acknowledged");
        handler = new AlertCommandHandler(alertService, alertsAcknowledgedCounter);
    }

    @Test
    void shouldCountEveryAlertTheServiceWrote() {
        // given
        var request = new AcknowledgeAlertRequest(
                SOME_MONITOR_ID, List.of(SOME_ALERT_ID, SOME_OTHER_ALERT_ID), RefreshPolicy.NONE);
        var outcome = new AcknowledgeOutcome(List.of(), List.of(SOME_ALERT_ID, SOME_OTHER_ALERT_ID), List.of());
        given(alertService.acknowledge(request)).willReturn(new AcknowledgeResult(outcome, 2));

        // when
        var result = handler.acknowledge(request);

        // then
        assertThat(result).isEqualTo(outcome);
        assertThat(alertsAcknowledgedCounter.count()).isEqualTo(2.0);
    }
}
