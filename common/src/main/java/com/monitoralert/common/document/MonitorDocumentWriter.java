package com.monitoralert.common.document;

import com.monitoralert.common.json.JacksonConfig;
import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.AlertHistoryEntry;
import com.monitoralert.common.model.Monitor;
import java.util.Collection;
import tools.jackson.databind.ObjectMapper;

/**
 * Writes monitor documents in the shape {@link MonitorDocumentParser} reads.
 */
public class MonitorDocumentWriter {

    private final ObjectMapper mapper;

    public MonitorDocumentWriter() {
        this(JacksonConfig.createObjectMapper());
    }

    public MonitorDocumentWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public MonitorDocument toDocument(Monitor monitor) {
        return MonitorDocument.from(monitor);
    }

    public String toJson(Monitor monitor) {
        return mapper.writeValueAsString(MonitorDocument.from(monitor));
    }

    public String toJson(ActionDefinition action) {
        return mapper.writeValueAsString(ActionDocument.from(action));
    }

    public String actionExecutionResultsToJson(Collection<ActionExecutionResult> results) {
        return mapper.writeValueAsString(results.stream().map(ActionExecutionResultDocument::from).toList());
    }

    public String alertHistoryToJson(Collection<AlertHistoryEntry> history) {
        return mapper.writeValueAsString(history.stream().map(AlertHistoryDocument::from).toList());
    }
}
