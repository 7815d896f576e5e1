package io.hivebus.transport.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.ConnectionFactory;
import io.hivebus.transport.AmqpTransporter;
import io.hivebus.transport.JsonPacketSerializer;
import io.hivebus.transport.PacketSerializer;
import io.hivebus.transport.connection.AmqpConnectionManager;
import io.hivebus.transport.consumer.MessageHandler;
import io.hivebus.transport.service.LocalServiceTopologySource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration that wires the AMQP transporter from {@code hivebus.transport.*}.
 * <p>
 * The transporter is only created once the application supplies a {@link MessageHandler} and a
 * {@link LocalServiceTopologySource}.
 */
@AutoConfiguration
@ConditionalOnClass({AmqpTransporter.class, ConnectionFactory.class})
@ConditionalOnProperty(prefix = "hivebus.transport", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TransportProperties.class)
public class TransportAutoConfiguration {

    @Bean(name = "hivebusConnectionFactory")
    @ConditionalOnMissingBean(ConnectionFactory.class)
    ConnectionFactory hivebusConnectionFactory(TransportProperties properties) {
        return AmqpConnectionManager.connectionFactory(properties.getUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    PacketSerializer packetSerializer(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new JsonPacketSerializer(mapper) : new JsonPacketSerializer();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean({MessageHandler.class, LocalServiceTopologySource.class})
    @ConditionalOnMissingBean
    AmqpTransporter amqpTransporter(TransportProperties properties,
                                    ConnectionFactory connectionFactory,
                                    PacketSerializer serializer,
                                    MessageHandler handler,
                                    LocalServiceTopologySource topologySource) {
        return AmqpTransporter.create(properties.toSettings(), connectionFactory, serializer, handler, topologySource);
    }

    @Bean
    @ConditionalOnBean({MessageHandler.class, LocalServiceTopologySource.class})
    @ConditionalOnProperty(prefix = "hivebus.transport", name = "auto-connect", havingValue = "true", matchIfMissing = true)
    TransportLifecycle transportLifecycle(AmqpTransporter transporter, TransportProperties properties) {
        return new TransportLifecycle(transporter, properties.getConnectTimeout());
    }
}
