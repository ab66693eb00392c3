package com.monitoralert.alertapi.application.controller.alert.mapper;

import com.monitoralert.alertapi.application.controller.alert.AcknowledgeAlertResponse;
import com.monitoralert.alertapi.application.controller.alert.AlertResponse;
import com.monitoralert.common.lifecycle.AcknowledgeOutcome;
import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.persistence.ActionExecutionResults;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface AlertResponseMapper {

    AlertResponse toResponse(Alert alert);

    default AcknowledgeAlertResponse toResponse(AcknowledgeOutcome outcome) {
        return new AcknowledgeAlertResponse(outcome.succeeded(), outcome.failed());
    }

    default List<ActionExecutionResult> resultsToList(Map<String, ActionExecutionResult> results) {
        return ActionExecutionResults.asList(results);
    }
}
