package com.zephyrus.agent.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zephyrus.agent.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Stateless JSON codec for the {@code {type, data}} envelope.
 *
 * <p>Older clients put {@code agent_id} at the top level or send {@code data} as a
 * JSON string; both are folded into a {@code data} object here so the handler
 * only ever sees one shape.
 */
@Component
public class ProtocolCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ProtocolCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws MalformedFrameException when the frame is not a JSON object with a string {@code type}
     * @throws ValidationException when the envelope is readable but {@code data} is not an object
     */
    public InboundMessage decode(String frame) throws MalformedFrameException {
        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("Frame must be a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new MalformedFrameException("Frame has no string 'type'");
        }

        String rawType = typeNode.asText();
        ObjectNode data = normalizeData(root.get("data"), rawType);

        for (String field : new String[]{"agent_id", "agentId"}) {
            JsonNode topLevel = root.get(field);
            if (topLevel != null && !topLevel.isNull() && !data.hasNonNull("agent_id")) {
                data.set("agent_id", topLevel);
            }
        }
        if (!data.hasNonNull("agent_id") && data.hasNonNull("agentId")) {
            data.set("agent_id", data.get("agentId"));
        }

        return new InboundMessage(rawType, MessageType.fromWire(rawType).orElse(null), data);
    }

    public <T> T bind(ObjectNode data, Class<T> type) {
        try {
            return mapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid payload: " + e.getOriginalMessage());
        }
    }

    public String encode(Envelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + envelope.getType() + " frame", e);
        }
    }

    /**
     * Converts a model object into the snake_case map used as frame data.
     */
    public Map<String, Object> toData(Object value) {
        return mapper.convertValue(value, MAP_TYPE);
    }

    private ObjectNode normalizeData(JsonNode data, String rawType) {
        if (data == null || data.isNull()) {
            return mapper.createObjectNode();
        }
        if (data.isObject()) {
            return (ObjectNode) data.deepCopy();
        }
        if (data.isTextual()) {
            try {
                JsonNode parsed = mapper.readTree(data.asText());
                if (parsed != null && parsed.isObject()) {
                    return (ObjectNode) parsed;
                }
            } catch (JsonProcessingException e) {
                throw new ValidationException("'data' of " + rawType + " is a string but not a JSON object");
            }
        }
        throw new ValidationException("'data' of " + rawType + " must be an object");
    }
}
