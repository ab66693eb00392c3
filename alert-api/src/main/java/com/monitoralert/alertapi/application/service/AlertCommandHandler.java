package com.monitoralert.alertapi.application.service;

import com.monitoralert.alertapi.domain.alert.AlertService;
import com.monitoralert.common.lifecycle.AcknowledgeOutcome;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertState;
import com.monitoralert.common.transport.AcknowledgeAlertRequest;
import io.micrometer.core.instrument.Counter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AlertCommandHandler {

    private final AlertService alertService;
    private final Counter alertsAcknowledgedCounter;

    public List<Alert> listAlerts(String monitorId, AlertState state) {
        return alertService.listAlerts(monitorId, state);
    }

    public AcknowledgeOutcome acknowledge(AcknowledgeAlertRequest request) {
        var result = alertService.acknowledge(request);
        alertsAcknowledgedCounter.increment(result.acknowledged());
        return result.outcome();
    }
}
