package io.hivebus.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import io.hivebus.transport.consumer.MessageHandler;
import io.hivebus.transport.service.LocalServiceTopology;
import io.hivebus.transport.service.LocalServiceTopologySource;
import io.hivebus.transport.service.ServiceDefinition;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AmqpTransporterTest {

    private final JsonPacketSerializer serializer = new JsonPacketSerializer();

    @Test
    void connectSubscribesTheDefaultTopics() throws Exception {
        MockBroker broker = new MockBroker("node-1");
        AmqpTransporter transporter = transporter(broker, (type, payload) -> null, () -> LocalServiceTopology.EMPTY);

        transporter.connect().join();

        assertThat(transporter.isConnected()).isTrue();
        verify(broker.channel).queueDeclare("MOL.REQUEST.node-1", true, false, false, Map.of());
        verify(broker.channel).queueDeclare("MOL.RESPONSE.node-1", true, false, false, Map.of());
        verify(broker.channel).queueDeclare("MOL.EVENT.node-1", true, false, true, Map.of("x-message-ttl", 5000L));
        verify(broker.channel).queueBind("MOL.EVENT.node-1", "MOL.EVENT", "");
        verify(broker.channel).queueBind("MOL.DISCOVER.node-1", "MOL.DISCOVER", "");
        verify(broker.channel).queueBind("MOL.INFO.node-1", "MOL.INFO", "");
        verify(broker.channel).queueBind("MOL.DISCONNECT.node-1", "MOL.DISCONNECT", "");
        verify(broker.channel).queueBind("MOL.HEARTBEAT.node-1", "MOL.HEARTBEAT", "");
        verify(broker.channel).queueBind("MOL.PING.node-1", "MOL.PING", "");
        verify(broker.channel, never()).queueBind(eq("MOL.PONG.node-1"), anyString(), anyString());
        assertThat(transporter.bindings().size()).isEqualTo(6);
    }

    @Test
    void connectingTwiceKeepsOneSetOfSubscriptions() throws Exception {
        MockBroker broker = new MockBroker("node-1");
        AmqpTransporter transporter = transporter(broker, (type, payload) -> null, () -> LocalServiceTopology.EMPTY);

        transporter.connect().join();
        transporter.connect().join();

        assertThat(transporter.bindings().size()).isEqualTo(6);
        verify(broker.channel, times(1)).queueBind("MOL.INFO.node-1", "MOL.INFO", "");
        verify(broker.channel, times(1)).basicConsume(eq("MOL.RESPONSE.node-1"), anyBoolean(), anyString(),
            anyBoolean(), anyBoolean(), anyMap(), any(DeliverCallback.class), any(CancelCallback.class));
    }

    @Test
    void reconnectAfterConnectionLossRecordsBindingsOnce() throws Exception {
        MockBroker broker = new MockBroker("node-1");
        AmqpTransporter transporter = transporter(broker, (type, payload) -> null, () -> LocalServiceTopology.EMPTY);
        transporter.connect().join();
        ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(broker.connection).addShutdownListener(listener.capture());

        listener.getValue().shutdownCompleted(new ShutdownSignalException(true, false, null, broker.connection));
        assertThat(transporter.isConnected()).isFalse();
        transporter.connect().join();

        assertThat(transporter.isConnected()).isTrue();
        assertThat(transporter.bindings().size()).isEqualTo(6);
        transporter.disconnect().join();
        verify(broker.channel, times(1)).queueUnbind("MOL.INFO.node-1", "MOL.INFO", "");
    }

    @Test
    void balancedRequestIsAckedOnceAndAnsweredToTheCaller() throws Exception {
        MockBroker workerBroker = new MockBroker("A");
        MockBroker callerBroker = new MockBroker("B");
        CompletableFuture<Object> work = new CompletableFuture<>();
        AmqpTransporter[] worker = new AmqpTransporter[1];
        MessageHandler workerHandler = (type, payload) -> {
            Packet request = serializer.deserialize(type, payload);
            return work.thenCompose(result -> worker[0].publish(
                Packet.to(PacketType.RESPONSE, "B", Map.of("id", request.payload().get("id"), "data", result))));
        };
        LocalServiceTopology services = new LocalServiceTopology(List.of(
            new ServiceDefinition("math", Set.of("sum"), Map.of())));
        worker[0] = transporter(workerBroker, workerHandler, () -> services);
        AmqpTransporter caller = transporter(callerBroker, (type, payload) -> null, () -> LocalServiceTopology.EMPTY);

        worker[0].connect().join();
        caller.connect().join();
        worker[0].publish(Packet.broadcast(PacketType.INFO, Map.of("services", List.of("math")))).join();
        caller.publish(Packet.broadcast(PacketType.REQUEST, Map.of(Packet.ACTION, "sum", "id", "r-1"))).join();

        ArgumentCaptor<byte[]> sent = ArgumentCaptor.forClass(byte[].class);
        verify(callerBroker.channel).basicPublish(eq(""), eq("MOL.REQUEST-LB.sum"), any(AMQP.BasicProperties.class),
            sent.capture());
        verify(callerBroker.channel).queueDeclare("MOL.RESPONSE.B", true, false, false, Map.of());

        workerBroker.consumerOf("MOL.REQUEST-LB.sum")
            .handle("ctag", MockBroker.delivery(11L, "MOL.REQUEST-LB.sum", sent.getValue()));
        verify(workerBroker.channel, never()).basicAck(anyLong(), anyBoolean());

        work.complete(15);

        verify(workerBroker.channel, times(1)).basicAck(11L, false);
        verify(workerBroker.channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
        ArgumentCaptor<byte[]> response = ArgumentCaptor.forClass(byte[].class);
        verify(workerBroker.channel).basicPublish(eq(""), eq("MOL.RESPONSE.B"), any(AMQP.BasicProperties.class),
            response.capture());
        Packet answer = serializer.deserialize(PacketType.RESPONSE, response.getValue());
        assertThat(answer.target()).isEqualTo("B");
        assertThat(answer.payload()).containsEntry("id", "r-1").containsEntry("data", 15);
    }

    @Test
    void closeReleasesBindingsAndConnection() throws Exception {
        MockBroker broker = new MockBroker("node-1");
        AmqpTransporter transporter = transporter(broker, (type, payload) -> null, () -> LocalServiceTopology.EMPTY);
        transporter.connect().join();

        transporter.close();

        verify(broker.channel).queueUnbind("MOL.PING.node-1", "MOL.PING", "");
        verify(broker.channel).close();
        verify(broker.connection).close();
        assertThat(transporter.bindings().size()).isZero();
        assertThat(transporter.isConnected()).isFalse();
    }

    @Test
    void describesItsTopics() throws Exception {
        TransportSettings settings = TransportSettings.builder(MockBroker.URL, "node-1").namespace("dev").build();
        AmqpTransporter transporter = new AmqpTransporter(settings, new MockBroker(settings).connectionFactory,
            serializer, (type, payload) -> null, () -> LocalServiceTopology.EMPTY, MockBroker.SAME_THREAD);

        assertThat(transporter.hasBuiltInBalancer()).isTrue();
        assertThat(transporter.topicName(PacketType.PONG, "node-2")).isEqualTo("MOL-dev.PONG.node-2");
        assertThat(transporter.topicName(PacketType.INFO, null)).isEqualTo("MOL-dev.INFO");
        assertThat(transporter.isConnected()).isFalse();
    }

    @Test
    void forUrlBuildsADisconnectedTransporterWithItsOwnExecutor() {
        AmqpTransporter transporter = AmqpTransporter.forUrl(MockBroker.URL, "node-9",
            (type, payload) -> null, () -> LocalServiceTopology.EMPTY);

        assertThat(transporter.isConnected()).isFalse();
        assertThat(transporter.topicName(PacketType.REQUEST, "node-9")).isEqualTo("MOL.REQUEST.node-9");
        assertThat(transporter.publish(Packet.broadcast(PacketType.PING, Map.of()))).succeedsWithin(Duration.ofSeconds(5));

        transporter.close();

        assertThat(transporter.disconnect()).isCompleted();
    }

    private AmqpTransporter transporter(MockBroker broker, MessageHandler handler,
                                        LocalServiceTopologySource source) {
        return new AmqpTransporter(broker.settings, broker.connectionFactory, serializer, handler, source,
            MockBroker.SAME_THREAD);
    }
}
