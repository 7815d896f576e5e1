package io.hivebus.transport.service;

import io.hivebus.transport.PacketType;
import io.hivebus.transport.connection.AmqpConnectionManager;
import io.hivebus.transport.consumer.AmqpSubscriber;
import io.hivebus.transport.topology.QueueCategory;
import io.hivebus.transport.topology.TopicNames;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the shared action queues and grouped event queues of the local services.
 * <p>
 * Queue declaration is idempotent on the broker, so the builder runs again on every topology
 * announcement and only attaches consumers to queues that do not have one yet.
 */
public final class ServiceTopologyBuilder {

    private static final Logger log = LoggerFactory.getLogger(ServiceTopologyBuilder.class);

    private final TopicNames names;
    private final AmqpConnectionManager connections;
    private final AmqpSubscriber subscriber;
    private final LocalServiceTopologySource topologySource;

    public ServiceTopologyBuilder(TopicNames names,
                                  AmqpConnectionManager connections,
                                  AmqpSubscriber subscriber,
                                  LocalServiceTopologySource topologySource) {
        this.names = Objects.requireNonNull(names, "names");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.topologySource = Objects.requireNonNull(topologySource, "topologySource");
    }

    public CompletableFuture<Void> declareServiceQueues() {
        return connections.execute(handle -> {
            LocalServiceTopology topology = Objects.requireNonNullElse(topologySource.snapshot(),
                LocalServiceTopology.EMPTY);
            int attached = 0;
            for (ServiceDefinition service : topology.services()) {
                for (String action : service.actions()) {
                    String queue = names.actionQueue(action);
                    if (subscriber.consumeShared(handle, queue, QueueCategory.REQUEST_LB, PacketType.REQUEST)) {
                        attached++;
                    }
                }
                for (String event : service.events().keySet()) {
                    String queue = names.eventGroupQueue(service.groupOf(event), event);
                    if (subscriber.consumeShared(handle, queue, QueueCategory.EVENT_LB, PacketType.EVENT)) {
                        attached++;
                    }
                }
            }
            log.info("Declared service queues for {} local service(s), {} new consumer(s)",
                topology.services().size(), attached);
            return null;
        });
    }
}
