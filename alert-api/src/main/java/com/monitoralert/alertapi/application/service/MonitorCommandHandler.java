package com.monitoralert.alertapi.application.service;

import com.monitoralert.alertapi.domain.monitor.MonitorService;
import com.monitoralert.common.model.Monitor;
import io.micrometer.core.instrument.Counter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MonitorCommandHandler {

    private final MonitorService monitorService;
    private final Counter monitorsCreatedCounter;
    private final Counter alertsDeletedCounter;

    public Monitor createMonitor(String document) {
        var monitor = monitorService.createMonitor(document);
        monitorsCreatedCounter.increment();
        return monitor;
    }

    public Monitor getMonitor(String monitorId) {
        return monitorService.getMonitor(monitorId);
    }

    public List<Monitor> listMonitors() {
        return monitorService.listMonitors();
    }

    public Monitor updateMonitor(String monitorId, String document, Long expectedVersion) {
        return monitorService.updateMonitor(monitorId, document, expectedVersion);
    }

    public void deleteMonitor(String monitorId) {
        alertsDeletedCounter.increment(monitorService.deleteMonitor(monitorId));
    }
}
