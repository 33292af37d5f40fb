package com.zephyrus.agent.protocol;

/**
 * Frame types the server emits that are not a direct {@code <verb>_response}.
 */
public final class OutboundType {

    public static final String EXECUTION_RESPONSE = "execution_response";
    public static final String LOG = "log";
    public static final String ERROR = "error";
    public static final String STATUS = "status";

    private OutboundType() {
    }
}
