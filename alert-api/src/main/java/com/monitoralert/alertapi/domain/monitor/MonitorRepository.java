package com.monitoralert.alertapi.domain.monitor;

import com.monitoralert.common.model.Monitor;
import java.util.List;
import java.util.Optional;

public interface MonitorRepository {

    Optional<Monitor> findById(String id);

    boolean existsById(String id);

    List<Monitor> findAll();

    /**
     * @param expectedVersion {@link MonitorService#NEW_MONITOR} to insert, otherwise the
     *                        version the caller read
     */
    Monitor save(Monitor monitor, long expectedVersion);

    void deleteById(String id);
}
