package io.hivebus.transport.topology;

import java.util.Map;

/**
 * Caller-supplied queue settings merged on top of the computed category defaults.
 * Every {@code null} field leaves the default untouched.
 */
public record QueueOverrides(Boolean durable,
                             Boolean exclusive,
                             Boolean autoDelete,
                             Long messageTtl,
                             Map<String, Object> arguments) {

    public static final QueueOverrides NONE = new QueueOverrides(null, null, null, null, Map.of());

    public QueueOverrides {
        if (messageTtl != null && messageTtl < 0) {
            throw new IllegalArgumentException("messageTtl must be >= 0");
        }
        arguments = arguments == null || arguments.isEmpty() ? Map.of() : Map.copyOf(arguments);
    }
}
