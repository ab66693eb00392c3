package com.monitoralert.alertapi.domain.alert;

import com.monitoralert.common.model.Alert;
import com.monitoralert.common.model.AlertState;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface AlertRepository {

    Optional<Alert> findById(String id);

    /**
     * @return the alerts that exist among {@code ids}, keyed by id
     */
    Map<String, Alert> findAllById(Collection<String> ids);

    /**
     * @param state optional filter, null for every state
     */
    List<Alert> findByMonitorId(String monitorId, AlertState state);

    List<Alert> findCurrentByMonitorId(String monitorId);

    List<Alert> findEndedBefore(Collection<AlertState> states, Instant cutoff);

    /**
     * Writes the alert if the stored version still equals {@code expectedVersion}.
     *
     * @throws com.monitoralert.common.exceptions.VersionConflictException otherwise
     */
    Alert save(Alert alert, long expectedVersion);
}
