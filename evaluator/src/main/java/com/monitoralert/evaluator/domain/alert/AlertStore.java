package com.monitoralert.evaluator.domain.alert;

import com.monitoralert.common.exceptions.VersionConflictException;
import com.monitoralert.common.model.Alert;
import java.util.Map;
import java.util.Optional;

/**
 * Alert persistence with optimistic versioning.
 */
public interface AlertStore {

    Optional<Alert> findCurrentAlert(String monitorId, String triggerId);

    /**
     * @return current alerts of the monitor keyed by trigger id
     */
    Map<String, Alert> findCurrentAlerts(String monitorId);

    /**
     * Writes {@code alert} if the stored version still equals {@code expectedVersion};
     * {@link Alert#UNSAVED_VERSION} means the alert must not exist yet.
     *
     * @return the alert as stored, carrying its new version
     * @throws VersionConflictException if another writer got there first
     */
    Alert persist(Alert alert, long expectedVersion);
}
