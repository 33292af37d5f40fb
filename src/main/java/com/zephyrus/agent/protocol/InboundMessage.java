package com.zephyrus.agent.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Decoded inbound frame. {@code type} is null when {@code rawType} is not a
 * known message kind.
 */
@Value
public class InboundMessage {
    String rawType;
    MessageType type;
    ObjectNode data;

    public String text(String field) {
        return data.hasNonNull(field) ? data.get(field).asText() : null;
    }
}
