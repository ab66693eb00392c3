package com.monitoralert.alertapi.application.job;

import com.monitoralert.alertapi.application.config.AlertingProperties;
import com.monitoralert.alertapi.domain.alert.AlertService;
import io.micrometer.core.instrument.Counter;
import jakarta.persistence.EntityManager;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tombstones finished alerts older than the retention window.
 * Uses pg_try_advisory_xact_lock so only one instance purges per run; the lock is released
 * when the transaction ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertRetentionScheduler {

    private static final long ADVISORY_LOCK_ID = 2001L;

    private final AlertService alertService;
    private final AlertingProperties properties;
    private final EntityManager entityManager;
    private final Clock clock;
    private final Counter alertsDeletedCounter;

    @Scheduled(cron = "${alerting.retention.cron}")
    @Transactional
    public void purgeFinishedAlerts() {
        if (!acquireAdvisoryLock()) {
            log.info("Alert retention: another instance holds the lock, skipping");
            return;
        }
        var cutoff = clock.instant().minus(properties.retention().completedAlerts());
        var deleted = alertService.deleteEndedBefore(cutoff);
        alertsDeletedCounter.increment(deleted);
        log.info("Alert retention complete: {} alerts ended before {} tombstoned", deleted, cutoff);
    }

    private boolean acquireAdvisoryLock() {
        var result =
                entityManager
                        .createNativeQuery("SELECT pg_try_advisory_xact_lock(:lockId)")
                        .setParameter("lockId", ADVISORY_LOCK_ID)
                        .getSingleResult();
        return Boolean.TRUE.equals(result);
    }
}
