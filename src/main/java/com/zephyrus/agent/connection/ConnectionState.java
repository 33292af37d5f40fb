package com.zephyrus.agent.connection;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-connection bookkeeping: the subscription index and the ids a frame falls
 * back to when it omits {@code agent_id} or {@code contract_id}.
 */
@Getter
public class ConnectionState {

    private final ClientConnection connection;
    private final Instant openedAt;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

    @Setter
    private volatile String defaultAgentId;

    @Setter
    private volatile String lastContractId;

    public ConnectionState(ClientConnection connection, Instant openedAt) {
        this.connection = connection;
        this.openedAt = openedAt;
    }

    public String getId() {
        return connection.getId();
    }
}
