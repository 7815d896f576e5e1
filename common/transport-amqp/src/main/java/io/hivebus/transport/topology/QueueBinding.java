package io.hivebus.transport.topology;

import java.util.Objects;

/**
 * Queue-to-exchange binding created by this node for broadcast delivery.
 */
public record QueueBinding(String queue, String exchange, String routingKey) {

    public QueueBinding {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
        if (exchange == null || exchange.isBlank()) {
            throw new IllegalArgumentException("exchange must not be blank");
        }
        routingKey = Objects.requireNonNullElse(routingKey, "");
    }

    public static QueueBinding fanout(String queue, String exchange) {
        return new QueueBinding(queue, exchange, "");
    }
}
