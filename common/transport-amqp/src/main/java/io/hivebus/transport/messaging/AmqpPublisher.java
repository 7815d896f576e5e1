package io.hivebus.transport.messaging;

import com.rabbitmq.client.AMQP;
import io.hivebus.transport.Packet;
import io.hivebus.transport.PacketSerializer;
import io.hivebus.transport.PacketType;
import io.hivebus.transport.connection.AmqpConnectionManager;
import io.hivebus.transport.service.ServiceTopologyBuilder;
import io.hivebus.transport.topology.TopicNames;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes outgoing packets to the queue or exchange that matches their delivery topology.
 * <ul>
 *   <li>grouped events go to one balanced queue per group, each copy narrowed to its group;</li>
 *   <li>requests without a target go to the shared queue of their action;</li>
 *   <li>targeted packets go straight to the node's queue;</li>
 *   <li>everything else is published to the category's fanout exchange.</li>
 * </ul>
 * Broadcasting an {@link PacketType#INFO} packet also (re)declares the service queues.
 */
public final class AmqpPublisher {

    private static final Logger log = LoggerFactory.getLogger(AmqpPublisher.class);
    private static final String DEFAULT_EXCHANGE = "";
    private static final String FANOUT_ROUTING_KEY = "";

    private final TopicNames names;
    private final AmqpConnectionManager connections;
    private final PacketSerializer serializer;
    private final ServiceTopologyBuilder serviceTopology;
    private final AMQP.BasicProperties properties;

    public AmqpPublisher(TopicNames names,
                         AmqpConnectionManager connections,
                         PacketSerializer serializer,
                         ServiceTopologyBuilder serviceTopology,
                         PublishOptions options) {
        this.names = Objects.requireNonNull(names, "names");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.serviceTopology = Objects.requireNonNull(serviceTopology, "serviceTopology");
        this.properties = withContentType(Objects.requireNonNull(options, "options"), serializer.contentType());
    }

    public CompletableFuture<Void> publish(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        if (connections.channel().isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return route(packet);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private CompletableFuture<Void> route(Packet packet) {
        PacketType type = packet.type();
        if (type == PacketType.EVENT && !packet.groups().isEmpty()) {
            if (!packet.hasTarget()) {
                return sendToGroups(packet);
            }
            log.debug("EVENT '{}' addressed to '{}'; ignoring groups {}", packet.event(), packet.target(), packet.groups());
        }
        if (type == PacketType.REQUEST && !packet.hasTarget()) {
            return sendToQueue(names.actionQueue(requireAction(packet)), serializer.serialize(packet));
        }
        if (packet.hasTarget()) {
            return sendToQueue(names.nodeQueue(type, packet.target()), serializer.serialize(packet));
        }
        CompletableFuture<Void> published = publishToExchange(names.exchange(type), serializer.serialize(packet));
        if (type == PacketType.INFO) {
            return published.thenCompose(ignored -> serviceTopology.declareServiceQueues());
        }
        return published;
    }

    private CompletableFuture<Void> sendToGroups(Packet packet) {
        String event = requireEvent(packet);
        List<String> queues = new ArrayList<>();
        List<byte[]> bodies = new ArrayList<>();
        for (String group : packet.groups()) {
            queues.add(names.eventGroupQueue(group, event));
            bodies.add(serializer.serialize(packet.withGroups(List.of(group))));
        }
        return connections.execute(handle -> {
            for (int i = 0; i < queues.size(); i++) {
                handle.channel().basicPublish(DEFAULT_EXCHANGE, queues.get(i), properties, bodies.get(i));
            }
            log.debug("Sent EVENT '{}' to {} group queue(s)", event, queues.size());
            return null;
        });
    }

    private CompletableFuture<Void> sendToQueue(String queue, byte[] body) {
        return connections.execute(handle -> {
            handle.channel().basicPublish(DEFAULT_EXCHANGE, queue, properties, body);
            return null;
        });
    }

    private CompletableFuture<Void> publishToExchange(String exchange, byte[] body) {
        return connections.execute(handle -> {
            handle.channel().basicPublish(exchange, FANOUT_ROUTING_KEY, properties, body);
            return null;
        });
    }

    private static String requireAction(Packet packet) {
        String action = packet.action();
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("REQUEST without target must carry an action");
        }
        return action;
    }

    private static String requireEvent(Packet packet) {
        String event = packet.event();
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("Grouped EVENT must carry an event name");
        }
        return event;
    }

    private static AMQP.BasicProperties withContentType(PublishOptions options, String contentType) {
        if (options.contentType() != null || contentType == null) {
            return options.toProperties();
        }
        return new PublishOptions(options.persistent(), options.expiration(), options.priority(),
            contentType, options.headers()).toProperties();
    }
}
