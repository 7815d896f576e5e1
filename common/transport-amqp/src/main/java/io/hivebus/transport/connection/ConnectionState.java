package io.hivebus.transport.connection;

/**
 * Lifecycle of the shared broker connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /**
     * The connection or its channel failed; nothing is usable until the next {@code connect()}.
     */
    DOWN
}
