package io.hivebus.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Moves protocol packets between nodes over a message broker.
 * <p>
 * Operations never fail just because the transporter is disconnected; they complete as no-ops.
 */
public interface Transporter extends AutoCloseable {

    CompletableFuture<Void> connect();

    CompletableFuture<Void> disconnect();

    /**
     * Subscribes to {@code type}; a {@code null} node id subscribes to the broadcast topology.
     */
    CompletableFuture<Void> subscribe(PacketType type, String nodeId);

    CompletableFuture<Void> publish(Packet packet);

    boolean isConnected();

    /**
     * Whether the broker itself balances requests and grouped events between nodes.
     */
    default boolean hasBuiltInBalancer() {
        return false;
    }

    String topicName(PacketType type, String nodeId);

    @Override
    void close();
}
