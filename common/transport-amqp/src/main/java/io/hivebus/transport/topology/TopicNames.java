package io.hivebus.transport.topology;

import io.hivebus.transport.PacketType;
import java.util.Objects;

/**
 * Builds queue and exchange names.
 * <p>
 * Names are part of the wire contract between nodes:
 * <ul>
 *   <li>{@code {prefix}.{category}} for exchanges,</li>
 *   <li>{@code {prefix}.{category}.{nodeId}} for node-addressed queues,</li>
 *   <li>{@code {prefix}.REQUEST-LB.{action}} for shared action queues,</li>
 *   <li>{@code {prefix}.EVENT-LB.{group}.{event}} for grouped event queues.</li>
 * </ul>
 */
public final class TopicNames {

    public static final String DEFAULT_PREFIX = "MOL";

    private final String prefix;

    public TopicNames(String prefix) {
        this.prefix = requireText(prefix, "prefix");
    }

    /**
     * Prefix {@code MOL}, or {@code MOL-{namespace}} when a namespace is set.
     */
    public static TopicNames forNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            return new TopicNames(DEFAULT_PREFIX);
        }
        return new TopicNames(DEFAULT_PREFIX + "-" + namespace.trim());
    }

    public String prefix() {
        return prefix;
    }

    public String topic(PacketType type, String nodeId) {
        Objects.requireNonNull(type, "type");
        String topic = prefix + "." + type.topicSegment();
        return nodeId == null ? topic : topic + "." + nodeId;
    }

    public String exchange(PacketType type) {
        return topic(type, null);
    }

    public String nodeQueue(PacketType type, String nodeId) {
        return topic(type, requireText(nodeId, "nodeId"));
    }

    public String actionQueue(String action) {
        return prefix + "." + QueueCategory.REQUEST_LB.segment() + "." + requireText(action, "action");
    }

    public String eventGroupQueue(String group, String event) {
        return prefix + "." + QueueCategory.EVENT_LB.segment() + "."
            + requireText(group, "group") + "." + requireText(event, "event");
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }
}
