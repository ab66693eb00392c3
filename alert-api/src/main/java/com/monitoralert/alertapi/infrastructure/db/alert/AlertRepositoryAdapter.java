package com.monitoralert.alertapi.infrastructure.db.alert;

import com.monitoralert.alertapi.domain.alert.AlertRepository;
import com.monitoralert.alertapi.infrastructure.db.alert.mapper.AlertEntityMapper;
import com.monitoralert.common.exceptions.VersionConflictException;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertState;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class AlertRepositoryAdapter implements AlertRepository {

    private static final List<AlertState> CURRENT_STATES =
            List.of(AlertState.ACTIVE, AlertState.ACKNOWLEDGED, AlertState.ERROR);

    private final AlertJpaRepository jpaRepository;
    private final AlertEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Alert> findById(String id) {
        return jpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Alert> findAllById(Collection<String> ids) {
        var alerts = new LinkedHashMap<String, Alert>();
        jpaRepository.findAllById(ids).forEach(entity -> alerts.put(entity.getId(), mapper.toDomain(entity)));
        return alerts;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> findByMonitorId(String monitorId, AlertState state) {
        return jpaRepository.findByMonitorIdAndOptionalState(monitorId, state).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> findCurrentByMonitorId(String monitorId) {
        return jpaRepository.findByMonitorIdAndStateInAndEndTimeIsNull(monitorId, CURRENT_STATES).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> findEndedBefore(Collection<AlertState> states, Instant cutoff) {
        return jpaRepository.findByStateInAndEndTimeBefore(states, cutoff).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public Alert save(Alert alert, long expectedVersion) {
        try {
            if (expectedVersion == Alert.UNSAVED_VERSION) {
                if (jpaRepository.existsById(alert.id())) {
                    throw VersionConflictException.alreadyExists(alert.id());
                }
                return mapper.toDomain(jpaRepository.saveAndFlush(mapper.toEntity(alert)));
            }
            var entity = jpaRepository.findById(alert.id())
                    .orElseThrow(() -> VersionConflictException.of(alert.id(), expectedVersion, Alert.UNSAVED_VERSION));
            long actual = entity.getVersion() == null ? Alert.UNSAVED_VERSION : entity.getVersion();
            if (actual != expectedVersion) {
                throw VersionConflictException.of(alert.id(), expectedVersion, actual);
            }
            mapper.updateEntity(alert, entity);
            return mapper.toDomain(jpaRepository.saveAndFlush(entity));
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw VersionConflictException.concurrentWrite(alert.id(), e);
        }
    }
}
