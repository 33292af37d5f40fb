package com.zephyrus.agent.client;

import lombok.Value;

import java.util.Map;

/**
 * Decision oracle answer: either no action, or one function with argument values.
 */
@Value
public class Decision {

    private static final Decision NO_ACTION = new Decision(null, Map.of());

    String functionName;
    Map<String, Object> parameters;

    public static Decision noAction() {
        return NO_ACTION;
    }

    public static Decision call(String functionName, Map<String, Object> parameters) {
        return new Decision(functionName, parameters == null ? Map.of() : parameters);
    }

    public boolean isNoAction() {
        return functionName == null;
    }
}
