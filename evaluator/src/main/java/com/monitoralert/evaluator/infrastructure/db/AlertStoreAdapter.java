package com.monitoralert.evaluator.infrastructure.db;

import com.monitoralert.common.exceptions.VersionConflictException;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertState;
import com.monitoralert.evaluator.domain.alert.AlertStore;
import com.monitoralert.evaluator.infrastructure.db.mapper.AlertRowMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Optimistic alert writes. The expected version is checked against the stored row before
 * the update, and Hibernate's version column catches writers that race past the check.
 * The partial unique index on open alerts catches a second alert opened for the same trigger.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class AlertStoreAdapter implements AlertStore {

    private static final List<AlertState> CURRENT_STATES =
            List.of(AlertState.ACTIVE, AlertState.ACKNOWLEDGED, AlertState.ERROR);

    private final AlertRowJpaRepository jpaRepository;
    private final AlertRowMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Alert> findCurrentAlert(String monitorId, String triggerId) {
        return jpaRepository.findCurrent(monitorId, triggerId, CURRENT_STATES).stream()
                .findFirst()
                .map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Alert> findCurrentAlerts(String monitorId) {
        var alerts = new LinkedHashMap<String, Alert>();
        for (var row : jpaRepository.findCurrent(monitorId, CURRENT_STATES)) {
            alerts.putIfAbsent(row.getTriggerId(), mapper.toDomain(row));
        }
        return alerts;
    }

    @Override
    @Transactional
    public Alert persist(Alert alert, long expectedVersion) {
        try {
            return expectedVersion == Alert.UNSAVED_VERSION ? insert(alert) : update(alert, expectedVersion);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.debug("Concurrent write on alert {}: {}", alert.id(), e.getMessage());
            throw VersionConflictException.concurrentWrite(alert.id(), e);
        }
    }

    private Alert insert(Alert alert) {
        if (jpaRepository.existsById(alert.id())) {
            throw VersionConflictException.alreadyExists(alert.id());
        }
        var saved = jpaRepository.saveAndFlush(mapper.toRow(alert));
        return mapper.toDomain(saved);
    }

    private Alert update(Alert alert, long expectedVersion) {
        var row = jpaRepository.findById(alert.id())
                .orElseThrow(() -> VersionConflictException.of(alert.id(), expectedVersion, Alert.UNSAVED_VERSION));
        if (row.getVersion() == null || row.getVersion() != expectedVersion) {
            throw VersionConflictException.of(
                    alert.id(), expectedVersion, row.getVersion() == null ? Alert.UNSAVED_VERSION : row.getVersion());
        }
        mapper.updateRow(alert, row);
        return mapper.toDomain(jpaRepository.saveAndFlush(row));
    }
}
