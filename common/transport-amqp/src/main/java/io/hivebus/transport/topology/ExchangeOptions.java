package io.hivebus.transport.topology;

import java.util.Map;

/**
 * Arguments of the fanout exchange declarations.
 */
public record ExchangeOptions(boolean durable,
                              boolean autoDelete,
                              boolean internal,
                              Map<String, Object> arguments) {

    public static final ExchangeOptions DEFAULTS = new ExchangeOptions(true, false, false, Map.of());

    public ExchangeOptions {
        arguments = arguments == null || arguments.isEmpty() ? Map.of() : Map.copyOf(arguments);
    }
}
