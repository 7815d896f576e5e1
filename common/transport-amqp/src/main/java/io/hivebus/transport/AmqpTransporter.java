package io.hivebus.transport;

import com.rabbitmq.client.ConnectionFactory;
import io.hivebus.transport.connection.AmqpConnectionManager;
import io.hivebus.transport.consumer.AmqpSubscriber;
import io.hivebus.transport.consumer.MessageHandler;
import io.hivebus.transport.messaging.AmqpPublisher;
import io.hivebus.transport.service.LocalServiceTopologySource;
import io.hivebus.transport.service.ServiceTopologyBuilder;
import io.hivebus.transport.topology.BindingRegistry;
import io.hivebus.transport.topology.TopicNames;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AMQP transporter: one connection, one channel, per-category queue topology.
 * <p>
 * Requests without a target and grouped events are balanced by the broker through shared queues
 * consumed with acknowledgments, so a message held by a worker that dies is redelivered to another
 * one. Responses, control packets and plain events are fire-and-forget.
 */
public final class AmqpTransporter implements Transporter {

    /**
     * Subscriptions made on every connect: {@code true} for node-addressed queues, {@code false} for broadcast.
     * A broadcast queue is named after this node, so it also receives packets targeted at the node.
     */
    static final List<Subscription> DEFAULT_SUBSCRIPTIONS = List.of(
        new Subscription(PacketType.EVENT, false),
        new Subscription(PacketType.REQUEST, true),
        new Subscription(PacketType.RESPONSE, true),
        new Subscription(PacketType.DISCOVER, false),
        new Subscription(PacketType.INFO, false),
        new Subscription(PacketType.DISCONNECT, false),
        new Subscription(PacketType.HEARTBEAT, false),
        new Subscription(PacketType.PING, false),
        new Subscription(PacketType.PONG, true));

    private static final Logger log = LoggerFactory.getLogger(AmqpTransporter.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final TransportSettings settings;
    private final TopicNames names;
    private final BindingRegistry bindings;
    private final AmqpConnectionManager connections;
    private final AmqpSubscriber subscriber;
    private final AmqpPublisher publisher;
    private final ExecutorService ownedExecutor;

    public AmqpTransporter(TransportSettings settings,
                           ConnectionFactory connectionFactory,
                           PacketSerializer serializer,
                           MessageHandler handler,
                           LocalServiceTopologySource topologySource,
                           Executor executor) {
        this(settings, connectionFactory, serializer, handler, topologySource, executor, null);
    }

    private AmqpTransporter(TransportSettings settings,
                            ConnectionFactory connectionFactory,
                            PacketSerializer serializer,
                            MessageHandler handler,
                            LocalServiceTopologySource topologySource,
                            Executor executor,
                            ExecutorService ownedExecutor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.names = settings.topicNames();
        this.bindings = new BindingRegistry();
        this.connections = new AmqpConnectionManager(settings, connectionFactory, bindings, executor);
        this.subscriber = new AmqpSubscriber(settings, bindings, connections, handler);
        ServiceTopologyBuilder serviceTopology = new ServiceTopologyBuilder(names, connections, subscriber, topologySource);
        this.publisher = new AmqpPublisher(names, connections, serializer, serviceTopology, settings.publishOptions());
        this.ownedExecutor = ownedExecutor;
    }

    /**
     * Transporter with its own serial executor and a JSON serializer, connecting to {@code settings.url()}.
     */
    public static AmqpTransporter create(TransportSettings settings,
                                         MessageHandler handler,
                                         LocalServiceTopologySource topologySource) {
        Objects.requireNonNull(settings, "settings");
        return create(settings, AmqpConnectionManager.connectionFactory(settings.url()),
            new JsonPacketSerializer(), handler, topologySource);
    }

    /**
     * Transporter with its own serial executor, stopped by {@link #close()}.
     */
    public static AmqpTransporter create(TransportSettings settings,
                                         ConnectionFactory connectionFactory,
                                         PacketSerializer serializer,
                                         MessageHandler handler,
                                         LocalServiceTopologySource topologySource) {
        Objects.requireNonNull(settings, "settings");
        ExecutorService executor = newSerialExecutor(settings.nodeId());
        return new AmqpTransporter(settings, connectionFactory, serializer, handler, topologySource,
            executor, executor);
    }

    public static AmqpTransporter forUrl(String url,
                                         String nodeId,
                                         MessageHandler handler,
                                         LocalServiceTopologySource topologySource) {
        return create(TransportSettings.builder(url, nodeId).build(), handler, topologySource);
    }

    @Override
    public CompletableFuture<Void> connect() {
        return connections.connect().thenCompose(opened -> {
            if (!opened) {
                log.debug("AMQP transporter already connected; keeping existing subscriptions");
                return CompletableFuture.<Void>completedFuture(null);
            }
            return subscribeDefaults();
        });
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        return connections.disconnect();
    }

    @Override
    public CompletableFuture<Void> subscribe(PacketType type, String nodeId) {
        return subscriber.subscribe(type, nodeId);
    }

    @Override
    public CompletableFuture<Void> publish(Packet packet) {
        return publisher.publish(packet);
    }

    @Override
    public boolean isConnected() {
        return connections.isConnected();
    }

    @Override
    public boolean hasBuiltInBalancer() {
        return true;
    }

    @Override
    public String topicName(PacketType type, String nodeId) {
        return names.topic(type, nodeId);
    }

    public BindingRegistry bindings() {
        return bindings;
    }

    /**
     * Disconnects and stops the executor this transporter created, if any.
     */
    @Override
    public void close() {
        try {
            disconnect().orTimeout(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException ex) {
            log.warn("AMQP transporter did not disconnect cleanly", ex);
        } finally {
            if (ownedExecutor != null) {
                ownedExecutor.shutdown();
            }
        }
    }

    private CompletableFuture<Void> subscribeDefaults() {
        CompletableFuture<?>[] subscriptions = DEFAULT_SUBSCRIPTIONS.stream()
            .map(subscription -> subscribe(subscription.type(),
                subscription.nodeAddressed() ? settings.nodeId() : null))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(subscriptions)
            .whenComplete((ignored, error) -> {
                if (error == null) {
                    log.info("AMQP transporter subscribed {} topic(s) for node '{}' (prefix '{}')",
                        subscriptions.length, settings.nodeId(), names.prefix());
                }
            });
    }

    static ExecutorService newSerialExecutor(String nodeId) {
        return Executors.newSingleThreadExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "hivebus-amqp-" + nodeId);
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    record Subscription(PacketType type, boolean nodeAddressed) {
    }
}
