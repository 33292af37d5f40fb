package com.zephyrus.agent.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Outbound wire frame: {@code {"type": ..., "data": {...}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Envelope {

    private final String type;
    private final Map<String, Object> data;

    public Envelope(String type, Map<String, Object> data) {
        this.type = type;
        this.data = data;
    }

    public static Envelope of(String type, Map<String, Object> data) {
        return new Envelope(type, data);
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String toString() {
        return "Envelope{type='" + type + "', data=" + data + "}";
    }
}
