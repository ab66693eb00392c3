package com.monitoralert.common.model;

import com.monitoralert.common.codec.RecordInput;
import com.monitoralert.common.codec.RecordOutput;
import com.monitoralert.common.codec.Writeable;
import com.monitoralert.common.exceptions.InvalidConfigException;
import java.io.IOException;
import java.util.Map;
import lombok.Builder;

/**
 * A notification action declared by a trigger. Immutable; an instance that violates the
 * template or throttle rules cannot be constructed.
 *
 * <p>Binary layout: {@code [name][destinationId][hasSubject][subject?][message]
 * [throttleEnabled][hasThrottle][throttle?][id]}.
 */
@Builder(toBuilder = true)
public record ActionDefinition(
        String id,
        String name,
        String destinationId,
        Script subjectTemplate,
        Script messageTemplate,
        boolean throttleEnabled,
        ThrottlePolicy throttle
) implements Writeable {

    public ActionDefinition {
        if (id == null) {
            throw InvalidConfigException.of("Action id is required");
        }
        if (name == null) {
            throw InvalidConfigException.of("Action name is required");
        }
        if (destinationId == null) {
            throw InvalidConfigException.of("Action " + name + ": destination id is required");
        }
        if (messageTemplate == null) {
            throw InvalidConfigException.of("Action " + name + ": message template is required");
        }
        checkTemplateLanguage("subject_template", subjectTemplate);
        checkTemplateLanguage("message_template", messageTemplate);
        if (throttleEnabled && throttle == null) {
            throw InvalidConfigException.throttleNotConfigured(name);
        }
    }

    /**
     * Templates are rendered with mustache; any other language is a configuration error.
     */
    public static void checkTemplateLanguage(String field, Script template) {
        if (template != null && !template.isLang(Script.MUSTACHE)) {
            throw InvalidConfigException.wrongLanguage(field, Script.MUSTACHE, template.lang());
        }
    }

    public Map<String, Object> asTemplateArg() {
        return Map.of("name", name);
    }

    @Override
    public void writeTo(RecordOutput out) throws IOException {
        out.writeString(name);
        out.writeString(destinationId);
        out.writeOptionalWriteable(subjectTemplate);
        messageTemplate.writeTo(out);
        out.writeBoolean(throttleEnabled);
        out.writeOptionalWriteable(throttle);
        out.writeString(id);
    }

    public static ActionDefinition readFrom(RecordInput in) throws IOException {
        var name = in.readString();
        var destinationId = in.readString();
        var subjectTemplate = in.readOptionalWriteable(Script::readFrom);
        var messageTemplate = Script.readFrom(in);
        checkTemplateLanguage("subject_template", subjectTemplate);
        checkTemplateLanguage("message_template", messageTemplate);
        var throttleEnabled = in.readBoolean();
        var throttle = in.readOptionalWriteable(ThrottlePolicy::readFrom);
        var id = in.readString();
        return new ActionDefinition(id, name, destinationId, subjectTemplate, messageTemplate, throttleEnabled, throttle);
    }
}
