package com.monitoralert.common.model;

import com.monitoralert.common.exceptions.InvalidConfigException;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * A scheduled search with the triggers evaluated against its results.
 */
@Builder(toBuilder = true)
public record Monitor(
        String id,
        long version,
        String name,
        boolean enabled,
        int intervalMinutes,
        SearchInput input,
        List<Trigger> triggers,
        String user
) {

    public Monitor {
        if (id == null || name == null) {
            throw InvalidConfigException.of("Monitor id and name are required");
        }
        if (intervalMinutes <= 0) {
            throw InvalidConfigException.of("Monitor " + name + ": interval must be positive, got: " + intervalMinutes);
        }
        input = input == null ? new SearchInput(List.of(), Map.of()) : input;
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        var triggerIds = new HashSet<String>();
        for (var trigger : triggers) {
            if (!triggerIds.add(trigger.id())) {
                throw InvalidConfigException.of("Monitor " + name + ": duplicate trigger id " + trigger.id());
            }
        }
    }

    public Duration interval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    public Map<String, Object> asTemplateArg() {
        var arg = new HashMap<String, Object>();
        arg.put("id", id);
        arg.put("version", version);
        arg.put("name", name);
        arg.put("enabled", enabled);
        arg.put("user", user);
        return arg;
    }
}
