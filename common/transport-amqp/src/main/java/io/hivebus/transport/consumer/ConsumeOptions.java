package io.hivebus.transport.consumer;

import java.util.Map;

/**
 * Caller-supplied consumer settings.
 *
 * @param noAck     overrides the acknowledgment mode chosen per category when non-null
 * @param exclusive request exclusive consumer access to the queue
 * @param arguments extra consumer arguments (for example {@code x-priority})
 */
public record ConsumeOptions(Boolean noAck, boolean exclusive, Map<String, Object> arguments) {

    public static final ConsumeOptions DEFAULTS = new ConsumeOptions(null, false, Map.of());

    public ConsumeOptions {
        arguments = arguments == null || arguments.isEmpty() ? Map.of() : Map.copyOf(arguments);
    }

    /**
     * Auto-ack flag for {@code basicConsume}: the configured value if set, otherwise {@code categoryNoAck}.
     */
    public boolean resolveNoAck(boolean categoryNoAck) {
        return noAck != null ? noAck : categoryNoAck;
    }
}
