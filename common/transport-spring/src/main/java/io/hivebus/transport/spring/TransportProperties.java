package io.hivebus.transport.spring;

import io.hivebus.transport.TransportSettings;
import io.hivebus.transport.consumer.ConsumeOptions;
import io.hivebus.transport.messaging.PublishOptions;
import io.hivebus.transport.topology.ExchangeOptions;
import io.hivebus.transport.topology.QueueOverrides;
import io.hivebus.transport.topology.TopologyPolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties of the AMQP transport ({@code hivebus.transport.*}).
 */
@Validated
@ConfigurationProperties(prefix = "hivebus.transport")
public class TransportProperties {

    private static final Pattern WHOLE_NUMBER = Pattern.compile("-?\\d+");

    private boolean enabled = true;
    private boolean autoConnect = true;
    @NotBlank
    private String url;
    @NotBlank
    private String nodeId;
    private String namespace;
    @Positive
    private int prefetch = TransportSettings.DEFAULT_PREFETCH;
    private Duration eventTimeToLive = TopologyPolicy.DEFAULT_EVENT_TIME_TO_LIVE;
    private Duration connectTimeout = Duration.ofSeconds(30);
    private final QueueProperties queue = new QueueProperties();
    private final ExchangeProperties exchange = new ExchangeProperties();
    private final MessageProperties message = new MessageProperties();
    private final ConsumeProperties consume = new ConsumeProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    public void setAutoConnect(boolean autoConnect) {
        this.autoConnect = autoConnect;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = requireText(url, "hivebus.transport.url");
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = requireText(nodeId, "hivebus.transport.node-id");
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public int getPrefetch() {
        return prefetch;
    }

    public void setPrefetch(int prefetch) {
        this.prefetch = prefetch;
    }

    public Duration getEventTimeToLive() {
        return eventTimeToLive;
    }

    public void setEventTimeToLive(Duration eventTimeToLive) {
        this.eventTimeToLive = Objects.requireNonNull(eventTimeToLive, "eventTimeToLive must not be null");
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
    }

    public QueueProperties getQueue() {
        return queue;
    }

    public ExchangeProperties getExchange() {
        return exchange;
    }

    public MessageProperties getMessage() {
        return message;
    }

    public ConsumeProperties getConsume() {
        return consume;
    }

    public TransportSettings toSettings() {
        return TransportSettings.builder(url, nodeId)
            .namespace(namespace)
            .prefetch(prefetch)
            .eventTimeToLive(eventTimeToLive)
            .queueOverrides(queue.toOverrides())
            .exchangeOptions(exchange.toOptions())
            .publishOptions(message.toOptions())
            .consumeOptions(consume.toOptions())
            .build();
    }

    /**
     * Overrides merged on top of every queue's category defaults. Unset values keep the defaults.
     */
    public static final class QueueProperties {
        private Boolean durable;
        private Boolean exclusive;
        private Boolean autoDelete;
        private Duration messageTtl;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        public Boolean getDurable() {
            return durable;
        }

        public void setDurable(Boolean durable) {
            this.durable = durable;
        }

        public Boolean getExclusive() {
            return exclusive;
        }

        public void setExclusive(Boolean exclusive) {
            this.exclusive = exclusive;
        }

        public Boolean getAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(Boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        public Duration getMessageTtl() {
            return messageTtl;
        }

        public void setMessageTtl(Duration messageTtl) {
            this.messageTtl = messageTtl;
        }

        public Map<String, Object> getArguments() {
            return arguments;
        }

        QueueOverrides toOverrides() {
            return new QueueOverrides(durable, exclusive, autoDelete,
                messageTtl == null ? null : messageTtl.toMillis(), brokerArguments(arguments));
        }
    }

    public static final class ExchangeProperties {
        private boolean durable = true;
        private boolean autoDelete;
        private boolean internal;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public boolean isAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        public boolean isInternal() {
            return internal;
        }

        public void setInternal(boolean internal) {
            this.internal = internal;
        }

        public Map<String, Object> getArguments() {
            return arguments;
        }

        ExchangeOptions toOptions() {
            return new ExchangeOptions(durable, autoDelete, internal, brokerArguments(arguments));
        }
    }

    public static final class MessageProperties {
        private Boolean persistent;
        private Duration expiration;
        private Integer priority;
        private String contentType;
        private final Map<String, Object> headers = new LinkedHashMap<>();

        public Boolean getPersistent() {
            return persistent;
        }

        public void setPersistent(Boolean persistent) {
            this.persistent = persistent;
        }

        public Duration getExpiration() {
            return expiration;
        }

        public void setExpiration(Duration expiration) {
            this.expiration = expiration;
        }

        public Integer getPriority() {
            return priority;
        }

        public void setPriority(Integer priority) {
            this.priority = priority;
        }

        public String getContentType() {
            return contentType;
        }

        public void setContentType(String contentType) {
            this.contentType = contentType;
        }

        public Map<String, Object> getHeaders() {
            return headers;
        }

        PublishOptions toOptions() {
            String expirationMs = expiration == null ? null : Long.toString(expiration.toMillis());
            return new PublishOptions(persistent, expirationMs, priority, contentType, brokerArguments(headers));
        }
    }

    public static final class ConsumeProperties {
        private Boolean noAck;
        private boolean exclusive;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        public Boolean getNoAck() {
            return noAck;
        }

        public void setNoAck(Boolean noAck) {
            this.noAck = noAck;
        }

        public boolean isExclusive() {
            return exclusive;
        }

        public void setExclusive(boolean exclusive) {
            this.exclusive = exclusive;
        }

        public Map<String, Object> getArguments() {
            return arguments;
        }

        ConsumeOptions toOptions() {
            return new ConsumeOptions(noAck, exclusive, brokerArguments(arguments));
        }
    }

    /**
     * Property maps bind every value as a string; the broker expects numeric and boolean
     * {@code x-} arguments as typed AMQP fields, so whole numbers become {@code Long} and
     * {@code true}/{@code false} become {@code Boolean}.
     */
    static Map<String, Object> brokerArguments(Map<String, Object> arguments) {
        Map<String, Object> typed = new LinkedHashMap<>();
        arguments.forEach((key, value) -> typed.put(key, brokerValue(value)));
        return typed;
    }

    private static Object brokerValue(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        String trimmed = text.trim();
        if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
            return Boolean.valueOf(trimmed);
        }
        if (WHOLE_NUMBER.matcher(trimmed).matches()) {
            try {
                return Long.valueOf(trimmed);
            } catch (NumberFormatException ex) {
                return text;
            }
        }
        return text;
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must not be null or blank");
        }
        return value;
    }
}
