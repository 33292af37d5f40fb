package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

public enum FunctionDirection {
    READ,
    WRITE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Maps both the client vocabulary (read / write / payable) and ABI state
     * mutability values (view / pure / nonpayable / payable).
     *
     * @return the direction, or null when the value is not recognised
     */
    public static FunctionDirection fromWire(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "read", "view", "pure" -> READ;
            case "write", "payable", "nonpayable" -> WRITE;
            default -> null;
        };
    }

    public static FunctionDirection fromAbiEntry(Map<String, Object> abiEntry) {
        Object mutability = abiEntry.get("stateMutability");
        if (mutability != null) {
            return fromWire(mutability.toString());
        }
        Object constant = abiEntry.get("constant");
        return Boolean.TRUE.equals(constant) ? READ : WRITE;
    }
}
