package com.monitoralert.alertapi.domain.alert;

import com.monitoralert.alertapi.domain.monitor.MonitorRepository;
import com.monitoralert.common.exceptions.MonitorNotFoundException;
import com.monitoralert.common.exceptions.VersionConflictException;
import com.monitoralert.common.lifecycle.AlertLifecycleTracker;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertState;
import com.monitoralert.common.transport.AcknowledgeAlertRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * User-facing alert operations. Writes go through the same optimistic version check the
 * evaluator uses, so an acknowledgment racing with an evaluation cycle is retried on a
 * fresh snapshot instead of overwriting it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    static final int MAX_WRITE_ATTEMPTS = 3;
    private static final List<AlertState> FINISHED_STATES = List.of(AlertState.COMPLETED, AlertState.ACKNOWLEDGED);

    private final AlertRepository alertRepository;
    private final MonitorRepository monitorRepository;
    private final AlertLifecycleTracker tracker;
    private final Clock clock;

    public List<Alert> listAlerts(String monitorId, AlertState state) {
        requireMonitor(monitorId);
        return alertRepository.findByMonitorId(monitorId, state);
    }

    public AcknowledgeResult acknowledge(AcknowledgeAlertRequest request) {
        requireMonitor(request.monitorId());
        VersionConflictException lastConflict = null;
        // saves that landed before a conflict stay written; the retry sees them as no-ops
        var acknowledged = 0;
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            var found = alertRepository.findAllById(request.alertIds());
            var outcome = tracker.acknowledge(request.monitorId(), request.alertIds(), found, clock.instant());
            try {
                for (var alert : outcome.toPersist()) {
                    alertRepository.save(alert, alert.version());
                    acknowledged++;
                }
                log.info("alerts.acknowledged: monitor_id={}, succeeded={}, failed={}, refresh={}",
                        request.monitorId(), outcome.succeeded(), outcome.failed(), request.refreshPolicy());
                return new AcknowledgeResult(outcome, acknowledged);
            } catch (VersionConflictException e) {
                lastConflict = e;
                log.warn("alerts.acknowledge_conflict: monitor_id={}, attempt={}, reason={}",
                        request.monitorId(), attempt, e.getMessage());
            }
        }
        throw lastConflict;
    }

    /**
     * Tombstones every open alert of a monitor that is being deleted.
     *
     * @return number of alerts moved to DELETED
     */
    public int deleteCurrentAlerts(String monitorId) {
        var now = clock.instant();
        var deleted = 0;
        for (var alert : alertRepository.findCurrentByMonitorId(monitorId)) {
            if (tombstone(alert.id(), now)) {
                deleted++;
            }
        }
        return deleted;
    }

    /**
     * Tombstones finished alerts (COMPLETED, or acknowledged after completion) that ended
     * before {@code cutoff}.
     *
     * @return number of alerts moved to DELETED
     */
    public int deleteEndedBefore(Instant cutoff) {
        var now = clock.instant();
        var deleted = 0;
        for (var alert : alertRepository.findEndedBefore(FINISHED_STATES, cutoff)) {
            if (tombstone(alert.id(), now)) {
                deleted++;
            }
        }
        return deleted;
    }

    private boolean tombstone(String alertId, Instant now) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            var alert = alertRepository.findById(alertId).orElse(null);
            if (alert == null || alert.state() == AlertState.DELETED) {
                return false;
            }
            try {
                alertRepository.save(tracker.delete(alert, now), alert.version());
                log.info("alert.deleted: alert_id={}, monitor_id={}, previous_state={}",
                        alertId, alert.monitorId(), alert.state());
                return true;
            } catch (VersionConflictException e) {
                log.warn("alert.delete_conflict: alert_id={}, attempt={}", alertId, attempt);
            }
        }
        return false;
    }

    private void requireMonitor(String monitorId) {
        if (!monitorRepository.existsById(monitorId)) {
            throw MonitorNotFoundException.of(monitorId);
        }
    }
}
