package com.monitoralert.alertapi.domain.monitor;

import com.monitoralert.alertapi.domain.alert.AlertService;
import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.exceptions.MonitorNotFoundException;
import com.monitoralert.common.model.Monitor;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MonitorService {

    public static final long NEW_MONITOR = -1L;

    private final MonitorRepository monitorRepository;
    private final AlertService alertService;
    private final MonitorDocumentParser parser;

    public Monitor createMonitor(String document) {
        var monitor = parser.parseMonitor(document);
        var saved = monitorRepository.save(monitor, NEW_MONITOR);
        log.info("monitor.created: monitor_id={}, triggers={}", saved.id(), saved.triggers().size());
        return saved;
    }

    public Monitor getMonitor(String monitorId) {
        return monitorRepository.findById(monitorId).orElseThrow(() -> MonitorNotFoundException.of(monitorId));
    }

    public List<Monitor> listMonitors() {
        return monitorRepository.findAll();
    }

    /**
     * Replaces the monitor document. The id in the path wins over any id in the body.
     *
     * @param expectedVersion version the client last read, or null to overwrite the current one
     */
    public Monitor updateMonitor(String monitorId, String document, Long expectedVersion) {
        var existing = getMonitor(monitorId);
        var monitor = parser.parseMonitor(document).toBuilder().id(monitorId).build();
        var saved = monitorRepository.save(
                monitor, expectedVersion != null ? expectedVersion : existing.version());
        log.info("monitor.updated: monitor_id={}, version={}", monitorId, saved.version());
        return saved;
    }

    /**
     * @return number of open alerts tombstoned with the monitor
     */
    public int deleteMonitor(String monitorId) {
        getMonitor(monitorId);
        monitorRepository.deleteById(monitorId);
        var deletedAlerts = alertService.deleteCurrentAlerts(monitorId);
        log.info("monitor.deleted: monitor_id={}, deleted_alerts={}", monitorId, deletedAlerts);
        return deletedAlerts;
    }
}
