package io.hivebus.transport.messaging;

import com.rabbitmq.client.AMQP;
import java.util.Map;

/**
 * Message properties applied to every outgoing packet.
 */
public record PublishOptions(Boolean persistent,
                             String expiration,
                             Integer priority,
                             String contentType,
                             Map<String, Object> headers) {

    public static final PublishOptions DEFAULTS = new PublishOptions(null, null, null, null, Map.of());

    private static final int PERSISTENT_DELIVERY_MODE = 2;
    private static final int TRANSIENT_DELIVERY_MODE = 1;

    public PublishOptions {
        if (expiration != null && expiration.isBlank()) {
            expiration = null;
        }
        if (priority != null && (priority < 0 || priority > 255)) {
            throw new IllegalArgumentException("priority must be between 0 and 255");
        }
        headers = headers == null || headers.isEmpty() ? Map.of() : Map.copyOf(headers);
    }

    public AMQP.BasicProperties toProperties() {
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder();
        if (persistent != null) {
            builder.deliveryMode(persistent ? PERSISTENT_DELIVERY_MODE : TRANSIENT_DELIVERY_MODE);
        }
        if (expiration != null) {
            builder.expiration(expiration);
        }
        if (priority != null) {
            builder.priority(priority);
        }
        if (contentType != null) {
            builder.contentType(contentType);
        }
        if (!headers.isEmpty()) {
            builder.headers(headers);
        }
        return builder.build();
    }
}
