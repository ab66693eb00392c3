package com.monitoralert.common.document;

import com.monitoralert.common.exceptions.ParseException;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.json.JacksonConfig;
import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.AlertHistoryEntry;
import com.monitoralert.common.model.Monitor;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.exc.UnrecognizedPropertyException;

/**
 * Reads monitor documents and their parts from JSON. The same parser validates user
 * requests and documents loaded back from storage.
 *
 * <p>Unknown fields are rejected while binding, before anything else is checked. Missing
 * ids are filled from the injected {@link IdGenerator}.
 */
public class MonitorDocumentParser {

    private static final Map<Class<?>, String> CONTEXTS = Map.of(
            MonitorDocument.class, MonitorDocument.CONTEXT,
            TriggerDocument.class, TriggerDocument.CONTEXT,
            ActionDocument.class, ActionDocument.CONTEXT,
            ThrottleDocument.class, "throttle",
            ScriptDocument.class, "script",
            InputsDocument.class, "inputs",
            SearchInputDocument.class, "search input",
            ActionExecutionResultDocument.class, "action execution result",
            AlertHistoryDocument.class, "alert history entry");

    private final IdGenerator idGenerator;
    private final ObjectMapper mapper;

    public MonitorDocumentParser(IdGenerator idGenerator) {
        this(idGenerator, JacksonConfig.createObjectMapper());
    }

    public MonitorDocumentParser(IdGenerator idGenerator, ObjectMapper mapper) {
        this.idGenerator = idGenerator;
        this.mapper = mapper;
    }

    public Monitor parseMonitor(String json) {
        return read(json, MonitorDocument.class, MonitorDocument.CONTEXT).toMonitor(idGenerator);
    }

    public ActionDefinition parseAction(String json) {
        return read(json, ActionDocument.class, ActionDocument.CONTEXT).toAction(idGenerator);
    }

    public List<ActionExecutionResult> parseActionExecutionResults(String json) {
        return Arrays.stream(read(json, ActionExecutionResultDocument[].class, "action execution results"))
                .map(ActionExecutionResultDocument::toResult)
                .toList();
    }

    public List<AlertHistoryEntry> parseAlertHistory(String json) {
        return Arrays.stream(read(json, AlertHistoryDocument[].class, "alert history"))
                .map(AlertHistoryDocument::toEntry)
                .toList();
    }

    private <T> T read(String json, Class<T> type, String context) {
        if (json == null || json.isBlank()) {
            throw ParseException.missingField("body", context);
        }
        T value;
        try {
            value = mapper.readerFor(type)
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(json);
        } catch (UnrecognizedPropertyException e) {
            throw ParseException.unexpectedField(
                    e.getPropertyName(), CONTEXTS.getOrDefault(e.getReferringClass(), context));
        } catch (JacksonException e) {
            throw ParseException.malformed(context, e);
        }
        if (value == null) {
            throw ParseException.missingField("body", context);
        }
        return value;
    }
}
