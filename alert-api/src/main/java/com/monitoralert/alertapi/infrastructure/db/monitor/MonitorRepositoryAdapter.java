package com.monitoralert.alertapi.infrastructure.db.monitor;

import com.monitoralert.alertapi.domain.monitor.MonitorRepository;
import com.monitoralert.alertapi.domain.monitor.MonitorService;
import com.monitoralert.alertapi.infrastructure.db.monitor.mapper.MonitorEntityMapper;
import com.monitoralert.common.exceptions.VersionConflictException;
import com.monitoralert.common.model.Monitor;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class MonitorRepositoryAdapter implements MonitorRepository {

    private final MonitorJpaRepository jpaRepository;
    private final MonitorEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Monitor> findById(String id) {
        return jpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsById(String id) {
        return jpaRepository.existsById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Monitor> findAll() {
        return jpaRepository.findAllByOrderByNameAsc().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public Monitor save(Monitor monitor, long expectedVersion) {
        var now = clock.instant();
        try {
            if (expectedVersion == MonitorService.NEW_MONITOR) {
                if (jpaRepository.existsById(monitor.id())) {
                    throw VersionConflictException.alreadyExists(monitor.id());
                }
                return mapper.toDomain(jpaRepository.saveAndFlush(mapper.toEntity(monitor, now)));
            }
            var entity = jpaRepository.findById(monitor.id())
                    .orElseThrow(() -> VersionConflictException.of(monitor.id(), expectedVersion, -1L));
            long actual = entity.getVersion() == null ? -1L : entity.getVersion();
            if (actual != expectedVersion) {
                throw VersionConflictException.of(monitor.id(), expectedVersion, actual);
            }
            mapper.updateEntity(monitor, entity, now);
            return mapper.toDomain(jpaRepository.saveAndFlush(entity));
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw VersionConflictException.concurrentWrite(monitor.id(), e);
        }
    }

    @Override
    @Transactional
    public void deleteById(String id) {
        jpaRepository.deleteById(id);
    }
}
