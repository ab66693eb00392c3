package com.monitoralert.common.persistence;

import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.document.MonitorDocumentWriter;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.model.ActionExecutionResult;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

/**
 * Stores an alert's action execution results as a JSON array in a text column.
 */
@Converter
public class ActionExecutionResultsConverter implements AttributeConverter<List<ActionExecutionResult>, String> {

    private final MonitorDocumentParser parser = new MonitorDocumentParser(IdGenerator.ULID);
    private final MonitorDocumentWriter writer = new MonitorDocumentWriter();

    @Override
    public String convertToDatabaseColumn(List<ActionExecutionResult> results) {
        return writer.actionExecutionResultsToJson(results == null ? List.of() : results);
    }

    @Override
    public List<ActionExecutionResult> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return parser.parseActionExecutionResults(json);
    }
}
