package io.hivebus.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed protocol packet handed to the transporter.
 *
 * @param type    packet category
 * @param target  receiving node id, or {@code null} for broadcast / action-routed requests
 * @param payload structured payload; {@code action}, {@code event} and {@code groups} drive routing
 */
public record Packet(PacketType type, String target, Map<String, Object> payload) {

    public static final String ACTION = "action";
    public static final String EVENT = "event";
    public static final String GROUPS = "groups";

    public Packet {
        type = Objects.requireNonNull(type, "type");
        target = normalise(target);
        payload = payload == null || payload.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Packet broadcast(PacketType type, Map<String, Object> payload) {
        return new Packet(type, null, payload);
    }

    public static Packet to(PacketType type, String target, Map<String, Object> payload) {
        return new Packet(type, requireText(target, "target"), payload);
    }

    public boolean hasTarget() {
        return target != null;
    }

    public String action() {
        return text(ACTION);
    }

    public String event() {
        return text(EVENT);
    }

    /**
     * Event groups carried by the payload; empty when the field is absent or not a list.
     */
    public List<String> groups() {
        Object value = payload.get(GROUPS);
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return List.of();
        }
        return list.stream()
            .filter(Objects::nonNull)
            .map(Object::toString)
            .toList();
    }

    /**
     * Returns a copy whose payload {@code groups} field is replaced by {@code groups}.
     */
    public Packet withGroups(List<String> groups) {
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        copy.put(GROUPS, List.copyOf(groups));
        return new Packet(type, target, copy);
    }

    private String text(String field) {
        Object value = payload.get(field);
        return value == null ? null : value.toString();
    }

    private static String normalise(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }
}
