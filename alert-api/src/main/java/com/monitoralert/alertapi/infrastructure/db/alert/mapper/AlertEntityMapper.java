package com.monitoralert.alertapi.infrastructure.db.alert.mapper;

import com.monitoralert.alertapi.infrastructure.db.alert.AlertEntity;
import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.Alert;
import com.monitoralert.common.persistence.ActionExecutionResults;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

@Mapper(componentModel = "spring")
public interface AlertEntityMapper {

    @Mapping(target = "version", ignore = true)
    AlertEntity toEntity(Alert alert);

    Alert toDomain(AlertEntity entity);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "version", ignore = true)
    void updateEntity(Alert alert, @MappingTarget AlertEntity entity);

    default List<ActionExecutionResult> resultsToList(Map<String, ActionExecutionResult> results) {
        return ActionExecutionResults.asList(results);
    }

    default Map<String, ActionExecutionResult> resultsToMap(List<ActionExecutionResult> results) {
        return ActionExecutionResults.byActionId(results);
    }
}
