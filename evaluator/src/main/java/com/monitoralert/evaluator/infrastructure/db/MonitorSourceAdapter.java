package com.monitoralert.evaluator.infrastructure.db;

import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.exceptions.ParseException;
import com.monitoralert.common.model.Monitor;
import com.monitoralert.evaluator.domain.monitor.MonitorSource;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Loads enabled monitors and re-validates each stored document with the shared parser.
 * A document that no longer parses is skipped for this round.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonitorSourceAdapter implements MonitorSource {

    private static final String ENABLED_MONITORS_SQL =
            "SELECT id, version, document FROM monitors WHERE enabled = TRUE ORDER BY id";

    private final JdbcTemplate jdbcTemplate;
    private final MonitorDocumentParser parser;

    @Override
    public List<Monitor> findEnabledMonitors() {
        var monitors = new ArrayList<Monitor>();
        jdbcTemplate.query(ENABLED_MONITORS_SQL, rs -> {
            var id = rs.getString("id");
            try {
                monitors.add(parser.parseMonitor(rs.getString("document")).toBuilder()
                        .id(id)
                        .version(rs.getLong("version"))
                        .enabled(true)
                        .build());
            } catch (ParseException e) {
                log.error("monitor.invalid_document: monitor_id={}, reason={}", id, e.getMessage());
            }
        });
        return monitors;
    }
}
