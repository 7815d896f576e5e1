package io.hivebus.transport.service;

import java.util.List;

/**
 * Snapshot of the services hosted by this node.
 */
public record LocalServiceTopology(List<ServiceDefinition> services) {

    public static final LocalServiceTopology EMPTY = new LocalServiceTopology(List.of());

    public LocalServiceTopology {
        services = services == null || services.isEmpty() ? List.of() : List.copyOf(services);
    }
}
