package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.model.ActionDefinition;
import com.monitoralert.common.model.Script;
import com.monitoralert.common.model.Trigger;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerDocument(
        String id,
        String name,
        String severity,
        ScriptDocument condition,
        List<ActionDocument> actions) {

    static final String CONTEXT = "trigger";

    static TriggerDocument from(Trigger trigger) {
        return new TriggerDocument(
                trigger.id(),
                trigger.name(),
                trigger.severity(),
                ScriptDocument.from(trigger.condition()),
                trigger.actions().stream().map(ActionDocument::from).toList());
    }

    Trigger toTrigger(IdGenerator idGenerator) {
        var triggerName = required(name, "name", CONTEXT);
        var parsedCondition = required(condition, "condition", CONTEXT).toScript(Script.SPEL);
        var parsedActions = actions == null
                ? List.<ActionDefinition>of()
                : actions.stream().map(action -> action.toAction(idGenerator)).toList();
        return Trigger.builder()
                .id(id == null ? idGenerator.generate() : id)
                .name(triggerName)
                .severity(severity)
                .condition(parsedCondition)
                .actions(parsedActions)
                .build();
    }
}
