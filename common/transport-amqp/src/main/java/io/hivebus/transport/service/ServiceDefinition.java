package io.hivebus.transport.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Locally hosted service as seen by the transport.
 *
 * @param name    service name, also the default group of its events
 * @param actions fully qualified action names
 * @param events  event name to the group that balances it ({@code null} group means the service name)
 */
public record ServiceDefinition(String name, Set<String> actions, Map<String, String> events) {

    public ServiceDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        actions = actions == null || actions.isEmpty() ? Set.of() : Set.copyOf(actions);
        events = events == null || events.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(events));
    }

    public String groupOf(String event) {
        String group = events.get(event);
        return group == null || group.isBlank() ? name : group;
    }
}
