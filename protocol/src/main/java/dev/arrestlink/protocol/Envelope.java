package dev.arrestlink.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One logical message: a type tag plus a JSON-compatible payload map. On the wire the body is a
 * JSON object with exactly two fields, {@code msg_type} and {@code data}.
 *
 * <p>The payload is copied on construction, nested maps and lists included, and every level is
 * unmodifiable.
 */
public record Envelope(String type, Map<String, Object> payload) {

    public static final String TYPE_FIELD = "msg_type";
    public static final String PAYLOAD_FIELD = "data";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    public Envelope {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Envelope type must not be blank");
        }
        payload = payload == null ? Collections.emptyMap() : freezeMap(payload);
    }

    // Map.copyOf and List.copyOf reject nulls, which are legal JSON values.
    private static <K> Map<K, Object> freezeMap(Map<K, ?> source) {
        Map<K, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public Envelope(String type) {
        this(type, null);
    }

    public String serialize() throws ProtocolException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(TYPE_FIELD, type);
        body.put(PAYLOAD_FIELD, payload);
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw ProtocolException.malformed("Cannot serialize envelope of type " + type, e);
        }
    }

    public static Envelope deserialize(String text) throws ProtocolException {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw ProtocolException.malformed("Frame body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw ProtocolException.malformed("Frame body is not a JSON object", null);
        }
        JsonNode typeNode = root.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw ProtocolException.malformed("Frame body has no '" + TYPE_FIELD + "' string", null);
        }
        JsonNode payloadNode = root.get(PAYLOAD_FIELD);
        if (payloadNode == null) {
            throw ProtocolException.malformed("Frame body has no '" + PAYLOAD_FIELD + "' field", null);
        }
        if (payloadNode.isNull()) {
            return new Envelope(typeNode.asText());
        }
        if (!payloadNode.isObject()) {
            throw ProtocolException.malformed("'" + PAYLOAD_FIELD + "' is not a JSON object", null);
        }
        return new Envelope(typeNode.asText(), MAPPER.convertValue(payloadNode, PAYLOAD_TYPE));
    }

    /** Convenience accessor for string payload entries; {@code null} when absent or not a string. */
    public String text(String key) {
        Object value = payload.get(key);
        return value instanceof String s ? s : null;
    }
}
