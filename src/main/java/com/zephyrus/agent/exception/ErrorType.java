package com.zephyrus.agent.exception;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    PRECONDITION,
    EXECUTION_FAILURE,
    TRANSPORT,
    INTERNAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
