package com.monitoralert.alertapi.infrastructure.db.alert;

import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.AlertHistoryEntry;
import com.monitoralert.common.model.AlertState;
import com.monitoralert.common.persistence.ActionExecutionResultsConverter;
import com.monitoralert.common.persistence.AlertHistoryConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "alerts")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Version
    private Long version;

    @Column(name = "monitor_id", nullable = false, length = 64)
    private String monitorId;

    @Column(name = "monitor_version", nullable = false)
    private long monitorVersion;

    @Column(name = "monitor_name", nullable = false)
    private String monitorName;

    @Column(name = "monitor_user")
    private String monitorUser;

    @Column(name = "trigger_id", nullable = false, length = 64)
    private String triggerId;

    @Column(name = "trigger_name", nullable = false)
    private String triggerName;

    @Column(length = 16)
    private String severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertState state;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Convert(converter = AlertHistoryConverter.class)
    @Column(name = "alert_history", nullable = false, columnDefinition = "text")
    private List<AlertHistoryEntry> alertHistory;

    @Convert(converter = ActionExecutionResultsConverter.class)
    @Column(name = "action_execution_results", nullable = false, columnDefinition = "text")
    private List<ActionExecutionResult> actionExecutionResults;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "last_notification_time")
    private Instant lastNotificationTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "acknowledged_time")
    private Instant acknowledgedTime;
}
