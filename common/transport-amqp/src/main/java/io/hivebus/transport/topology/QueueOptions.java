package io.hivebus.transport.topology;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective arguments of a queue declaration.
 *
 * @param durable    survive broker restarts
 * @param exclusive  restrict the queue to the declaring connection
 * @param autoDelete drop the queue once its last consumer goes away
 * @param messageTtl per-message expiry in milliseconds, {@code null} for messages that never expire
 * @param arguments  extra {@code x-} arguments passed through to the broker
 */
public record QueueOptions(boolean durable,
                           boolean exclusive,
                           boolean autoDelete,
                           Long messageTtl,
                           Map<String, Object> arguments) {

    static final String MESSAGE_TTL_ARGUMENT = "x-message-ttl";

    public QueueOptions {
        if (messageTtl != null && messageTtl < 0) {
            throw new IllegalArgumentException("messageTtl must be >= 0");
        }
        arguments = arguments == null || arguments.isEmpty() ? Map.of() : Map.copyOf(arguments);
    }

    public static QueueOptions permanent() {
        return new QueueOptions(true, false, false, null, Map.of());
    }

    public static QueueOptions expiring(long messageTtl) {
        return new QueueOptions(true, false, true, messageTtl, Map.of());
    }

    public boolean expires() {
        return messageTtl != null;
    }

    /**
     * Overlays {@code overrides}; any non-null override field wins, arguments merge key by key.
     */
    public QueueOptions merge(QueueOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        Map<String, Object> mergedArguments = new LinkedHashMap<>(arguments);
        mergedArguments.putAll(overrides.arguments());
        return new QueueOptions(
            overrides.durable() != null ? overrides.durable() : durable,
            overrides.exclusive() != null ? overrides.exclusive() : exclusive,
            overrides.autoDelete() != null ? overrides.autoDelete() : autoDelete,
            overrides.messageTtl() != null ? overrides.messageTtl() : messageTtl,
            mergedArguments);
    }

    /**
     * Arguments map handed to {@code queueDeclare}, including the TTL when one applies.
     */
    public Map<String, Object> declareArguments() {
        if (messageTtl == null) {
            return arguments;
        }
        Map<String, Object> declared = new LinkedHashMap<>(arguments);
        declared.putIfAbsent(MESSAGE_TTL_ARGUMENT, messageTtl);
        return declared;
    }
}
