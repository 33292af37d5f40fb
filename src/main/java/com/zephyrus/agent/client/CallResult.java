package com.zephyrus.agent.client;

import lombok.Value;

/**
 * Read calls carry a value; write calls carry the pending transaction hash.
 */
@Value
public class CallResult {
    Object value;
    String callId;

    public static CallResult value(Object value) {
        return new CallResult(value, null);
    }

    public static CallResult pending(String callId) {
        return new CallResult(null, callId);
    }
}
