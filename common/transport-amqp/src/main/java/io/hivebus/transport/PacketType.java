package io.hivebus.transport;

/**
 * Packet categories of the inter-node protocol.
 * <p>
 * The enum name doubles as the topic segment used in queue and exchange names.
 */
public enum PacketType {
    REQUEST,
    RESPONSE,
    EVENT,
    DISCOVER,
    INFO,
    DISCONNECT,
    HEARTBEAT,
    PING,
    PONG,
    UNKNOWN;

    public String topicSegment() {
        return name();
    }
}
