package io.hivebus.transport.consumer;

import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import io.hivebus.transport.PacketType;
import io.hivebus.transport.connection.AmqpConnectionManager;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards deliveries to the {@link MessageHandler} and settles them when acknowledgments are required.
 * <p>
 * With {@code needAck} a delivery is acked once the handler result completes successfully and
 * nacked (requeued) when it fails or the handler throws. Settlement goes through the channel
 * generation the consumer was registered on; if that channel is gone the ack or nack is skipped
 * and the broker redelivers the message on its own.
 */
public final class AcknowledgingDeliveryCallback implements DeliverCallback {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgingDeliveryCallback.class);

    private final PacketType type;
    private final boolean needAck;
    private final MessageHandler handler;
    private final AmqpConnectionManager connections;
    private final long generation;

    public AcknowledgingDeliveryCallback(PacketType type,
                                         boolean needAck,
                                         MessageHandler handler,
                                         AmqpConnectionManager connections,
                                         long generation) {
        this.type = Objects.requireNonNull(type, "type");
        this.needAck = needAck;
        this.handler = Objects.requireNonNull(handler, "handler");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.generation = generation;
    }

    @Override
    public void handle(String consumerTag, Delivery delivery) {
        long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        CompletionStage<?> result;
        try {
            result = handler.handle(type, delivery.getBody());
        } catch (Exception ex) {
            log.error("Message handling error (type={}, routingKey='{}')",
                type, delivery.getEnvelope().getRoutingKey(), ex);
            if (needAck) {
                nack(deliveryTag);
            }
            return;
        }
        if (result == null) {
            if (needAck) {
                ack(deliveryTag);
            }
            return;
        }
        result.whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Message handling error (type={}, routingKey='{}')",
                    type, delivery.getEnvelope().getRoutingKey(), error);
                if (needAck) {
                    nack(deliveryTag);
                }
            } else if (needAck) {
                ack(deliveryTag);
            }
        });
    }

    private void ack(long deliveryTag) {
        connections.execute(generation, handle -> {
            handle.channel().basicAck(deliveryTag, false);
            return null;
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Failed to ack {} delivery {}", type, deliveryTag, error);
            }
        });
    }

    private void nack(long deliveryTag) {
        connections.execute(generation, handle -> {
            handle.channel().basicNack(deliveryTag, false, true);
            return null;
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Failed to nack {} delivery {}", type, deliveryTag, error);
            }
        });
    }
}
