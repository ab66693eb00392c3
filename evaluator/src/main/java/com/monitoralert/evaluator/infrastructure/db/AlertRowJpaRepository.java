package com.monitoralert.evaluator.infrastructure.db;

import com.monitoralert.common.model.AlertState;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AlertRowJpaRepository extends JpaRepository<AlertRow, String> {

    @Query("""
            SELECT a FROM AlertRow a
            WHERE a.monitorId = :monitorId
              AND a.state IN :states
              AND a.endTime IS NULL
            """)
    List<AlertRow> findCurrent(@Param("monitorId") String monitorId, @Param("states") Collection<AlertState> states);

    @Query("""
            SELECT a FROM AlertRow a
            WHERE a.monitorId = :monitorId
              AND a.triggerId = :triggerId
              AND a.state IN :states
              AND a.endTime IS NULL
            """)
    List<AlertRow> findCurrent(
            @Param("monitorId") String monitorId,
            @Param("triggerId") String triggerId,
            @Param("states") Collection<AlertState> states);
}
