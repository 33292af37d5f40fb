package com.zephyrus.agent.service;

import com.zephyrus.agent.connection.ClientConnection;
import com.zephyrus.agent.connection.ConnectionState;
import com.zephyrus.agent.protocol.Envelope;
import com.zephyrus.agent.protocol.ProtocolCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections and the agents each one is subscribed to. Outbound events
 * for an agent go only to its subscribers.
 */
@Slf4j
@Service
public class ConnectionRegistryService {

    private final ProtocolCodec codec;
    private final Clock clock;

    private final Map<String, ConnectionState> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subscribersByAgent = new ConcurrentHashMap<>();

    public ConnectionRegistryService(ProtocolCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    public ConnectionState register(ClientConnection connection) {
        ConnectionState state = new ConnectionState(connection, clock.instant());
        connections.put(connection.getId(), state);
        log.info("Client connected: {} (total {})", connection.getId(), connections.size());
        return state;
    }

    public Optional<ConnectionState> unregister(String connectionId) {
        ConnectionState state = connections.remove(connectionId);
        if (state == null) {
            return Optional.empty();
        }
        for (String agentId : state.getSubscriptions()) {
            subscribersByAgent.computeIfPresent(agentId, (id, subscribers) -> {
                subscribers.remove(connectionId);
                return subscribers.isEmpty() ? null : subscribers;
            });
        }
        log.info("Client disconnected: {} (total {})", connectionId, connections.size());
        return Optional.of(state);
    }

    public Optional<ConnectionState> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public void subscribe(String connectionId, String agentId) {
        ConnectionState state = connections.get(connectionId);
        if (state == null) {
            return;
        }
        if (state.getSubscriptions().add(agentId)) {
            subscribersByAgent.compute(agentId, (id, subscribers) -> {
                Set<String> updated = subscribers != null ? subscribers : ConcurrentHashMap.newKeySet();
                updated.add(connectionId);
                return updated;
            });
            log.debug("Connection {} subscribed to agent {}", connectionId, agentId);
        }
    }

    public void unsubscribe(String connectionId, String agentId) {
        ConnectionState state = connections.get(connectionId);
        if (state != null) {
            state.getSubscriptions().remove(agentId);
        }
        subscribersByAgent.computeIfPresent(agentId, (id, subscribers) -> {
            subscribers.remove(connectionId);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    /**
     * Drops every subscription to a removed agent.
     */
    public void forgetAgent(String agentId) {
        Set<String> subscribers = subscribersByAgent.remove(agentId);
        if (subscribers == null) {
            return;
        }
        for (String connectionId : subscribers) {
            ConnectionState state = connections.get(connectionId);
            if (state != null) {
                state.getSubscriptions().remove(agentId);
                if (agentId.equals(state.getDefaultAgentId())) {
                    state.setDefaultAgentId(null);
                }
            }
        }
    }

    public Set<String> subscribersOf(String agentId) {
        Set<String> subscribers = subscribersByAgent.get(agentId);
        return subscribers == null ? Set.of() : Set.copyOf(subscribers);
    }

    public int connectionCount() {
        return connections.size();
    }

    /**
     * Sends to every connection subscribed to {@code agentId}.
     *
     * @return number of connections the frame was written to
     */
    public int publish(String agentId, Envelope envelope) {
        Set<String> subscribers = subscribersByAgent.get(agentId);
        if (subscribers == null || subscribers.isEmpty()) {
            return 0;
        }
        String frame = codec.encode(envelope);
        int delivered = 0;
        for (String connectionId : subscribers) {
            if (write(connectionId, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    public boolean send(String connectionId, Envelope envelope) {
        return write(connectionId, codec.encode(envelope));
    }

    public void closeForBadData(String connectionId, String reason) {
        ConnectionState state = connections.get(connectionId);
        if (state == null) {
            return;
        }
        try {
            state.getConnection().closeForBadData(reason);
        } catch (IOException e) {
            log.warn("Closing connection {} failed: {}", connectionId, e.getMessage());
        }
    }

    private boolean write(String connectionId, String frame) {
        ConnectionState state = connections.get(connectionId);
        if (state == null || !state.getConnection().isOpen()) {
            return false;
        }
        try {
            state.getConnection().send(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            // transport closes the connection and calls unregister
            log.warn("Send to connection {} failed: {}", connectionId, e.getMessage());
            return false;
        }
    }
}
