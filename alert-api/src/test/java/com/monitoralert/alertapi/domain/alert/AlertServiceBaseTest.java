package com.monitoralert.alertapi.domain.alert;

import static com.monitoralert.alertapi.test.fixtures.AlertApiFixtures.NOW;

import com.monitoralert.alertapi.domain.monitor.MonitorRepository;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.lifecycle.AlertLifecycleTracker;
import java.time.Clock;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public abstract class AlertServiceBaseTest {

    @Mock
    AlertRepository alertRepository;

    @Mock
    MonitorRepository monitorRepository;

    AlertService alertService;

    @BeforeEach
    void setUpService() {
        alertService = new AlertService(
                alertRepository,
                monitorRepository,
                new AlertLifecycleTracker(IdGenerator.ULID),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
