package io.hivebus.transport;

/**
 * Raised when a broker operation fails for a reason other than the channel going away.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
