package com.monitoralert.evaluator.infrastructure.db.mapper;

import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.persistence.ActionExecutionResults;
import com.monitoralert.evaluator.infrastructure.db.AlertRow;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

@Mapper(componentModel = "spring")
public interface AlertRowMapper {

    @Mapping(target = "version", ignore = true)
    AlertRow toRow(Alert alert);

    Alert toDomain(AlertRow row);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "version", ignore = true)
    void updateRow(Alert alert, @MappingTarget AlertRow row);

    default List<ActionExecutionResult> resultsToList(Map<String, ActionExecutionResult> results) {
        return ActionExecutionResults.asList(results);
    }

    default Map<String, ActionExecutionResult> resultsToMap(List<ActionExecutionResult> results) {
        return ActionExecutionResults.byActionId(results);
    }
}
