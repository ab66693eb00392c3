package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.model.Monitor;
import com.monitoralert.common.model.Trigger;
import java.util.List;

/**
 * Stored and exchanged form of a {@link Monitor}. The version lives outside the document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitorDocument(
        String id,
        String name,
        Boolean enabled,
        @JsonProperty("interval_minutes") Integer intervalMinutes,
        InputsDocument inputs,
        List<TriggerDocument> triggers,
        String user) {

    static final String CONTEXT = "monitor";

    public static MonitorDocument from(Monitor monitor) {
        return new MonitorDocument(
                monitor.id(),
                monitor.name(),
                monitor.enabled(),
                monitor.intervalMinutes(),
                InputsDocument.from(monitor.input()),
                monitor.triggers().stream().map(TriggerDocument::from).toList(),
                monitor.user());
    }

    Monitor toMonitor(IdGenerator idGenerator) {
        var monitorName = required(name, "name", CONTEXT);
        var interval = required(intervalMinutes, "interval_minutes", CONTEXT);
        var input = inputs == null ? null : inputs.toSearchInput();
        var parsedTriggers = triggers == null
                ? List.<Trigger>of()
                : triggers.stream().map(trigger -> trigger.toTrigger(idGenerator)).toList();
        return Monitor.builder()
                .id(id == null ? idGenerator.generate() : id)
                .version(0L)
                .name(monitorName)
                .enabled(enabled == null || enabled)
                .intervalMinutes(interval)
                .input(input)
                .triggers(parsedTriggers)
                .user(user)
                .build();
    }
}
