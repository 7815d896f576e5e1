package io.hivebus.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson-backed serializer that writes the packet payload as a UTF-8 JSON object.
 * The packet type travels in the queue or exchange name, the target in the {@code target} field.
 */
public final class JsonPacketSerializer implements PacketSerializer {

    static final String TARGET_FIELD = "target";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonPacketSerializer() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public JsonPacketSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public byte[] serialize(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        try {
            Map<String, Object> body = packet.payload();
            if (packet.hasTarget() && !body.containsKey(TARGET_FIELD)) {
                body = new LinkedHashMap<>(body);
                body.put(TARGET_FIELD, packet.target());
            }
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException ex) {
            throw new TransportException("Failed to serialize " + packet.type() + " packet", ex);
        }
    }

    @Override
    public Packet deserialize(PacketType type, byte[] body) {
        Objects.requireNonNull(type, "type");
        if (body == null || body.length == 0) {
            return new Packet(type, null, Map.of());
        }
        try {
            Map<String, Object> payload = objectMapper.readValue(body, PAYLOAD_TYPE);
            Object target = payload == null ? null : payload.get(TARGET_FIELD);
            return new Packet(type, target == null ? null : target.toString(), payload);
        } catch (IOException ex) {
            throw new TransportException("Failed to deserialize " + type + " packet", ex);
        }
    }

    @Override
    public String contentType() {
        return "application/json";
    }
}
