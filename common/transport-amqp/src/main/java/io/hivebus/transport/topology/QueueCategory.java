package io.hivebus.transport.topology;

import io.hivebus.transport.PacketType;
import java.util.Objects;

/**
 * Keys of the topology policy: one per packet type plus the two load-balanced queue kinds.
 */
public enum QueueCategory {
    REQUEST("REQUEST"),
    RESPONSE("RESPONSE"),
    EVENT("EVENT"),
    DISCOVER("DISCOVER"),
    INFO("INFO"),
    DISCONNECT("DISCONNECT"),
    HEARTBEAT("HEARTBEAT"),
    PING("PING"),
    PONG("PONG"),
    UNKNOWN("UNKNOWN"),
    REQUEST_LB("REQUEST-LB"),
    EVENT_LB("EVENT-LB");

    private final String segment;

    QueueCategory(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    public static QueueCategory of(PacketType type) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case REQUEST -> REQUEST;
            case RESPONSE -> RESPONSE;
            case EVENT -> EVENT;
            case DISCOVER -> DISCOVER;
            case INFO -> INFO;
            case DISCONNECT -> DISCONNECT;
            case HEARTBEAT -> HEARTBEAT;
            case PING -> PING;
            case PONG -> PONG;
            case UNKNOWN -> UNKNOWN;
        };
    }
}
