package io.hivebus.transport;

/**
 * Converts packets to and from the bytes carried by broker messages.
 */
public interface PacketSerializer {

    byte[] serialize(Packet packet);

    Packet deserialize(PacketType type, byte[] body);

    /**
     * MIME type stamped on outgoing messages, or {@code null} to leave it unset.
     */
    default String contentType() {
        return null;
    }
}
