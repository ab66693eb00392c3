package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.common.model.Script;

/**
 * JSON form of an {@link ActionDefinition}. {@code subject_template} and {@code throttle}
 * are omitted on output when null; an explicit {@code null} is accepted on input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionDocument(
        String id,
        String name,
        @JsonProperty("destination_id") String destinationId,
        @JsonProperty("subject_template") ScriptDocument subjectTemplate,
        @JsonProperty("message_template") ScriptDocument messageTemplate,
        @JsonProperty("throttle_enabled") Boolean throttleEnabled,
        ThrottleDocument throttle) {

    static final String CONTEXT = "action";

    public static ActionDocument from(ActionDefinition action) {
        return new ActionDocument(
                action.id(),
                action.name(),
                action.destinationId(),
                ScriptDocument.from(action.subjectTemplate()),
                ScriptDocument.from(action.messageTemplate()),
                action.throttleEnabled(),
                ThrottleDocument.from(action.throttle()));
    }

    public ActionDefinition toAction(IdGenerator idGenerator) {
        var actionName = required(name, "name", CONTEXT);
        var destination = required(destinationId, "destination_id", CONTEXT);
        var message = required(messageTemplate, "message_template", CONTEXT).toScript(Script.MUSTACHE);
        var subject = subjectTemplate == null ? null : subjectTemplate.toScript(Script.MUSTACHE);
        // template languages are reported before any throttle problem
        ActionDefinition.checkTemplateLanguage("subject_template", subject);
        ActionDefinition.checkTemplateLanguage("message_template", message);
        return ActionDefinition.builder()
                .id(id == null ? idGenerator.generate() : id)
                .name(actionName)
                .destinationId(destination)
                .subjectTemplate(subject)
                .messageTemplate(message)
                .throttleEnabled(Boolean.TRUE.equals(throttleEnabled))
                .throttle(throttle == null ? null : throttle.toThrottle())
                .build();
    }
}
