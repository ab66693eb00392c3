package com.monitoralert.common.model;

import com.monitoralert.common.exceptions.InvalidConfigException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import lombok.Builder;

@Builder(toBuilder = true)
public record Trigger(
        String id,
        String name,
        String severity,
        Script condition,
        List<ActionDefinition> actions
) {

    public Trigger {
        if (id == null || name == null) {
            throw InvalidConfigException.of("Trigger id and name are required");
        }
        if (condition == null) {
            throw InvalidConfigException.of("Trigger " + name + ": condition is required");
        }
        if (!condition.isLang(Script.SPEL)) {
            throw InvalidConfigException.wrongLanguage("condition", Script.SPEL, condition.lang());
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
        var actionIds = new HashSet<String>();
        for (var action : actions) {
            if (!actionIds.add(action.id())) {
                throw InvalidConfigException.of("Trigger " + name + ": duplicate action id " + action.id());
            }
        }
    }

    public Map<String, Object> asTemplateArg() {
        var arg = new HashMap<String, Object>();
        arg.put("id", id);
        arg.put("name", name);
        arg.put("severity", severity);
        arg.put("actions", actions.stream().map(ActionDefinition::asTemplateArg).toList());
        return arg;
    }
}
