package com.monitoralert.alertapi.domain.monitor;

import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.MONITOR_DOCUMENT;
import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.SOME_MONITOR_ID;
import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.monitorBuilder;
import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.sequentialIds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

import com.monitoralert.alertapi.domain.alert.AlertService;
import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.exceptions.InvalidConfigException;
import com.monitoralert.common.exceptions.MonitorNotFoundException;
import com.monitoralert.common.exceptions.ParseException;
import com.monitoralert.common.model.Monitor;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MonitorServiceTest {

    @Mock
    MonitorRepository monitorRepository;

    @Mock
    AlertService alertService;

    private MonitorService monitorService;

    @BeforeEach
    void setUp() {
        monitorService = new MonitorService(
                monitorRepository, alertService, new MonitorDocumentParser(sequentialIds("gen_")));
    }

    @Test
    void shouldCreateMonitorWithGeneratedIds() {
        // given
        given(monitorRepository.save(any(Monitor.class), eq(MonitorService.NEW_MONITOR)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        var monitor = monitorService.createMonitor(MONITOR_DOCUMENT);

        // then
        assertThat(monitor.id()).isEqualTo("gen_3");
        assertThat(monitor.triggers()).singleElement().satisfies(trigger -> {
            assertThat(trigger.id()).isEqualTo("gen_2");
            assertThat(trigger.actions().get(0).id()).isEqualTo("gen_1");
            assertThat(trigger.actions().get(0).throttle().value()).isEqualTo(5);
        });
    }

    @Test
    void shouldRejectDocumentWithUnknownField() {
        // when / then
        assertThatThrownBy(() -> monitorService.createMonitor("""
                {"name": "m", "interval_minutes": 1, "schedule": "daily"}
                """))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("schedule");
        then(monitorRepository).should(never()).save(any(), anyLong());
    }

    @Test
    void shouldRejectThrottleEnabledWithoutThrottle() {
        // when / then
        assertThatThrownBy(() -> monitorService.createMonitor("""
                {"name": "m", "interval_minutes": 1, "triggers": [{
                  "name": "t", "condition": {"source": "true"},
                  "actions": [{"name": "a", "destination_id": "d",
                               "message_template": {"source": "x"}, "throttle_enabled": true}]
                }]}
                """))
                .isInstanceOf(InvalidConfigException.class);
        then(monitorRepository).should(never()).save(any(), anyLong());
    }

    @Test
    void shouldUpdateWithPathIdAndCurrentVersion() {
        // given
        var existing = monitorBuilder().version(7L).build();
        given(monitorRepository.findById(SOME_MONITOR_ID)).willReturn(Optional.of(existing));
        given(monitorRepository.save(any(Monitor.class), eq(7L))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        var updated = monitorService.updateMonitor(SOME_MONITOR_ID, MONITOR_DOCUMENT, null);

        // then
        assertThat(updated.id()).isEqualTo(SOME_MONITOR_ID);
    }

    @Test
    void shouldUpdateAgainstClientVersion() {
        // given
        given(monitorRepository.findById(SOME_MONITOR_ID)).willReturn(Optional.of(monitorBuilder().version(7L).build()));
        given(monitorRepository.save(any(Monitor.class), eq(6L))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        monitorService.updateMonitor(SOME_MONITOR_ID, MONITOR_DOCUMENT, 6L);

        // then
        var captor = ArgumentCaptor.forClass(Monitor.class);
        then(monitorRepository).should().save(captor.capture(), eq(6L));
        assertThat(captor.getValue().name()).isEqualTo("checkout errors");
    }

    @Test
    void shouldFailToGetMissingMonitor() {
        // given
        given(monitorRepository.findById(anyString())).willReturn(Optional.empty());

        // when / then
        assertThatThrownBy(() -> monitorService.getMonitor("mon_missing"))
                .isInstanceOf(MonitorNotFoundException.class);
    }

    @Test
    void shouldDeleteMonitorAndTombstoneItsOpenAlerts() {
        // given
        given(monitorRepository.findById(SOME_MONITOR_ID)).willReturn(Optional.of(monitorBuilder().build()));
        given(alertService.deleteCurrentAlerts(SOME_MONITOR_ID)).willReturn(2);

        // when
        var deletedAlerts = monitorService.deleteMonitor(SOME_MONITOR_ID);

        // then
        assertThat(deletedAlerts).isEqualTo(2);
        then(monitorRepository).should().deleteById(SOME_MONITOR_ID);
    }
}
