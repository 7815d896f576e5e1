package io.hivebus.transport.consumer;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import io.hivebus.transport.PacketType;
import io.hivebus.transport.TransportSettings;
import io.hivebus.transport.connection.AmqpConnectionManager;
import io.hivebus.transport.connection.ChannelHandle;
import io.hivebus.transport.topology.BindingRegistry;
import io.hivebus.transport.topology.ExchangeOptions;
import io.hivebus.transport.topology.QueueBinding;
import io.hivebus.transport.topology.QueueCategory;
import io.hivebus.transport.topology.QueueOptions;
import io.hivebus.transport.topology.TopicNames;
import io.hivebus.transport.topology.TopologyPolicy;
import java.io.IOException;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the queues, exchanges and bindings of each packet category and attaches consumers.
 * <p>
 * Node-addressed categories get a single queue named after the node. Broadcast categories get a
 * fanout exchange plus one queue per node bound to it; the binding is recorded so a graceful
 * disconnect can unwind it. Both consume without acknowledgments. Shared action queues and grouped
 * event queues are declared later through {@link #consumeShared} once the local services are known.
 */
public final class AmqpSubscriber {

    private static final Logger log = LoggerFactory.getLogger(AmqpSubscriber.class);

    private final TransportSettings settings;
    private final TopicNames names;
    private final TopologyPolicy policy;
    private final BindingRegistry bindings;
    private final AmqpConnectionManager connections;
    private final MessageHandler handler;

    // confined to the connection manager's executor
    private final Set<String> sharedConsumers = new HashSet<>();
    private long sharedConsumersGeneration;

    public AmqpSubscriber(TransportSettings settings,
                          BindingRegistry bindings,
                          AmqpConnectionManager connections,
                          MessageHandler handler) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.names = settings.topicNames();
        this.policy = settings.topologyPolicy();
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Subscribes to {@code type}; {@code nodeId == null} selects the broadcast topology.
     * Completes immediately when no channel is available.
     */
    public CompletableFuture<Void> subscribe(PacketType type, String nodeId) {
        Objects.requireNonNull(type, "type");
        QueueCategory category = QueueCategory.of(type);
        if (nodeId != null) {
            String queue = names.nodeQueue(type, nodeId);
            return connections.execute(handle -> {
                declareQueue(handle.channel(), queue, category);
                consume(handle, queue, type, false);
                return null;
            });
        }
        String exchange = names.exchange(type);
        String queue = names.nodeQueue(type, settings.nodeId());
        QueueBinding binding = QueueBinding.fanout(queue, exchange);
        return connections.execute(handle -> {
            Channel channel = handle.channel();
            declareExchange(channel, exchange);
            declareQueue(channel, queue, category);
            bindings.record(binding);
            channel.queueBind(binding.queue(), binding.exchange(), binding.routingKey());
            consume(handle, queue, type, false);
            return null;
        });
    }

    /**
     * Declares a queue shared by competing workers and consumes it with acknowledgments.
     * Runs on the caller's channel operation; a queue gets at most one consumer per channel generation.
     *
     * @return {@code true} when a new consumer was attached
     */
    public boolean consumeShared(ChannelHandle handle, String queue, QueueCategory category, PacketType type)
        throws IOException {
        declareQueue(handle.channel(), queue, category);
        if (sharedConsumersGeneration != handle.generation()) {
            sharedConsumers.clear();
            sharedConsumersGeneration = handle.generation();
        }
        if (!sharedConsumers.add(queue)) {
            log.debug("Queue '{}' already has a consumer on this channel", queue);
            return false;
        }
        consume(handle, queue, type, true);
        return true;
    }

    /**
     * Delivery callback for {@code type} consumers; acknowledgments go to channel {@code generation} only.
     */
    public DeliverCallback consumeHandler(PacketType type, boolean needAck, long generation) {
        return new AcknowledgingDeliveryCallback(type, needAck, handler, connections, generation);
    }

    private void declareExchange(Channel channel, String exchange) throws IOException {
        ExchangeOptions options = settings.exchangeOptions();
        channel.exchangeDeclare(exchange, BuiltinExchangeType.FANOUT, options.durable(),
            options.autoDelete(), options.internal(), options.arguments());
    }

    private void declareQueue(Channel channel, String queue, QueueCategory category) throws IOException {
        QueueOptions options = policy.optionsFor(category);
        channel.queueDeclare(queue, options.durable(), options.exclusive(), options.autoDelete(),
            options.declareArguments());
    }

    private void consume(ChannelHandle handle, String queue, PacketType type, boolean needAck) throws IOException {
        ConsumeOptions options = settings.consumeOptions();
        boolean autoAck = options.resolveNoAck(!needAck);
        String consumerTag = handle.channel().basicConsume(
            queue,
            autoAck,
            "",
            false,
            options.exclusive(),
            options.arguments(),
            consumeHandler(type, !autoAck, handle.generation()),
            tag -> log.warn("Consumer '{}' on queue '{}' was cancelled by the broker", tag, queue));
        log.debug("Consuming {} packets from '{}' (consumerTag='{}', autoAck={})", type, queue, consumerTag, autoAck);
    }
}
