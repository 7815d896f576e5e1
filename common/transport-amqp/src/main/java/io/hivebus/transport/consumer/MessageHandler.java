package io.hivebus.transport.consumer;

import io.hivebus.transport.PacketType;
import java.util.concurrent.CompletionStage;

/**
 * Upper-layer handler that receives raw packet payloads.
 * <p>
 * Returning {@code null} (or an already completed stage) marks the message as handled synchronously.
 * Returning a pending stage defers acknowledgment of acknowledged deliveries until it completes;
 * a failed stage or a thrown exception requeues them.
 */
@FunctionalInterface
public interface MessageHandler {

    CompletionStage<?> handle(PacketType type, byte[] payload) throws Exception;
}
