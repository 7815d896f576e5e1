package io.hivebus.transport.consumer;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.hivebus.transport.MockBroker;
import io.hivebus.transport.PacketType;
import io.hivebus.transport.connection.AmqpConnectionManager;
import io.hivebus.transport.topology.BindingRegistry;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AcknowledgingDeliveryCallbackTest {

    private static final byte[] BODY = "{\"action\":\"math.add\"}".getBytes(StandardCharsets.UTF_8);

    private MockBroker broker;
    private AmqpConnectionManager connections;

    @BeforeEach
    void setUp() throws Exception {
        broker = new MockBroker("node-1");
        connections = broker.connected(new BindingRegistry());
    }

    @Test
    void acksOnceWhenAsyncHandlingSucceeds() throws Exception {
        CompletableFuture<Object> handling = new CompletableFuture<>();
        AcknowledgingDeliveryCallback callback = callback(true, (type, payload) -> handling);

        callback.handle("ctag", MockBroker.delivery(42L, "MOL.REQUEST-LB.math.add", BODY));
        verify(broker.channel, never()).basicAck(anyLong(), anyBoolean());

        handling.complete("done");

        verify(broker.channel, times(1)).basicAck(42L, false);
        verify(broker.channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void nacksOnceWhenAsyncHandlingFails() throws Exception {
        CompletableFuture<Object> handling = new CompletableFuture<>();
        AcknowledgingDeliveryCallback callback = callback(true, (type, payload) -> handling);

        callback.handle("ctag", MockBroker.delivery(7L, "MOL.REQUEST-LB.math.add", BODY));
        handling.completeExceptionally(new IllegalStateException("worker crashed"));

        verify(broker.channel, times(1)).basicNack(7L, false, true);
        verify(broker.channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void acksSynchronousHandling() throws Exception {
        AcknowledgingDeliveryCallback callback = callback(true, (type, payload) -> null);

        callback.handle("ctag", MockBroker.delivery(3L, "MOL.EVENT-LB.users.user.created", BODY));

        verify(broker.channel).basicAck(3L, false);
    }

    @Test
    void nacksWhenHandlerThrows() throws Exception {
        AcknowledgingDeliveryCallback callback = callback(true, (type, payload) -> {
            throw new IllegalArgumentException("bad payload");
        });

        callback.handle("ctag", MockBroker.delivery(5L, "MOL.REQUEST-LB.math.add", BODY));

        verify(broker.channel).basicNack(5L, false, true);
        verify(broker.channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void leavesAutoAckedDeliveriesAlone() throws Exception {
        AcknowledgingDeliveryCallback callback = callback(false, (type, payload) -> {
            throw new IllegalArgumentException("bad payload");
        });

        callback.handle("ctag", MockBroker.delivery(1L, "", BODY));
        callback(false, (type, payload) -> null).handle("ctag", MockBroker.delivery(2L, "", BODY));

        verify(broker.channel, never()).basicAck(anyLong(), anyBoolean());
        verify(broker.channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void skipsSettlementOnReplacedChannel() throws Exception {
        AcknowledgingDeliveryCallback stale =
            new AcknowledgingDeliveryCallback(PacketType.REQUEST, true, (type, payload) -> null, connections, 99L);

        stale.handle("ctag", MockBroker.delivery(9L, "", BODY));

        verify(broker.channel, never()).basicAck(anyLong(), anyBoolean());
    }

    private AcknowledgingDeliveryCallback callback(boolean needAck, MessageHandler handler) {
        long generation = connections.channel().orElseThrow().generation();
        return new AcknowledgingDeliveryCallback(PacketType.REQUEST, needAck, handler, connections, generation);
    }
}
