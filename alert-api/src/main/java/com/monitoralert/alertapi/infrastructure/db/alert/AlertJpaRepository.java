package com.monitoralert.alertapi.infrastructure.db.alert;

import com.monitoralert.common.model.AlertState;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface AlertJpaRepository extends JpaRepository<AlertEntity, String> {

    @Query(
            """
            SELECT a FROM AlertEntity a
            WHERE a.monitorId = :monitorId
            AND (:state IS NULL OR a.state = :state)
            ORDER BY a.startTime DESC
            """)
    List<AlertEntity> findByMonitorIdAndOptionalState(String monitorId, AlertState state);

    List<AlertEntity> findByMonitorIdAndStateInAndEndTimeIsNull(String monitorId, Collection<AlertState> states);

    List<AlertEntity> findByStateInAndEndTimeBefore(Collection<AlertState> states, Instant cutoff);
}
