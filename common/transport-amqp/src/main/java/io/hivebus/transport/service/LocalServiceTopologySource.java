package io.hivebus.transport.service;

/**
 * Registry-side view of the local services, read each time the node announces itself.
 */
@FunctionalInterface
public interface LocalServiceTopologySource {

    LocalServiceTopology snapshot();
}
