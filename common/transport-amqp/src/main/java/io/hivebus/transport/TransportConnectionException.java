package io.hivebus.transport;

/**
 * Terminal failure of the broker connection or its channel. Never retried by the transport.
 */
public class TransportConnectionException extends TransportException {

    public TransportConnectionException(String message) {
        super(message);
    }

    public TransportConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
