package com.zephyrus.agent.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of inbound message kinds. Adding a kind means adding a constant
 * here and a branch in {@link ProtocolHandler}.
 */
public enum MessageType {
    CREATE_CONTRACT("create_contract"),
    CREATE_AGENT("create_agent"),
    CREATE_FUNCTION("create_function"),
    CREATE_SCHEDULE("create_schedule"),
    CREATE_NOTIFICATION("create_notification"),
    CONFIGURE_AGENT("configure_agent"),
    START_AGENT("start_agent"),
    STOP_AGENT("stop_agent"),
    EXECUTE("execute", OutboundType.EXECUTION_RESPONSE, "websocket_execution"),
    REMOVE_AGENT("remove_agent"),
    LOAD_AGENT("load_agent", null, "add_agent"),
    AGENT_STATUS("agent_status"),
    LIST_AGENTS("list_agents"),
    EXECUTION_HISTORY("execution_history");

    private final String wireName;
    private final String responseType;
    private final List<String> deprecatedAliases;

    MessageType(String wireName) {
        this(wireName, null);
    }

    MessageType(String wireName, String responseType, String... deprecatedAliases) {
        this.wireName = wireName;
        this.responseType = responseType != null ? responseType : wireName + "_response";
        this.deprecatedAliases = List.of(deprecatedAliases);
    }

    public String wireName() {
        return wireName;
    }

    public String responseType() {
        return responseType;
    }

    public boolean isAlias(String name) {
        return deprecatedAliases.contains(name);
    }

    public static Optional<MessageType> fromWire(String name) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(name) || t.deprecatedAliases.contains(name))
            .findFirst();
    }
}
