package com.zephyrus.agent.protocol;

import com.zephyrus.agent.connection.ClientConnection;
import com.zephyrus.agent.connection.ConnectionState;
import com.zephyrus.agent.exception.AgentOperationException;
import com.zephyrus.agent.exception.ErrorType;
import com.zephyrus.agent.exception.NotFoundException;
import com.zephyrus.agent.exception.ValidationException;
import com.zephyrus.agent.model.AgentDefinition;
import com.zephyrus.agent.model.AgentSpec;
import com.zephyrus.agent.model.AgentView;
import com.zephyrus.agent.model.ContractDefinition;
import com.zephyrus.agent.model.ContractSpec;
import com.zephyrus.agent.model.FunctionSpec;
import com.zephyrus.agent.model.NotificationSpec;
import com.zephyrus.agent.model.Schedule;
import com.zephyrus.agent.model.ScheduleSpec;
import com.zephyrus.agent.service.AgentManagerService;
import com.zephyrus.agent.service.ConnectionRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns each inbound frame into exactly one agent manager operation and answers
 * on the originating connection.
 *
 * <p>Undecodable frames close the connection. Everything else that goes wrong,
 * including unknown message types, is answered with an {@code error} frame and
 * the connection stays open.
 */
@Slf4j
@Component
public class ProtocolHandler {

    static final int DEFAULT_HISTORY_LIMIT = 20;

    private final ProtocolCodec codec;
    private final ConnectionRegistryService registry;
    private final AgentManagerService manager;

    public ProtocolHandler(ProtocolCodec codec, ConnectionRegistryService registry, AgentManagerService manager) {
        this.codec = codec;
        this.registry = registry;
        this.manager = manager;
    }

    /**
     * @param pathAgentId agent id taken from the connection URL, or null
     */
    public void onOpen(ClientConnection connection, String pathAgentId) {
        ConnectionState state = registry.register(connection);
        if (pathAgentId != null && !pathAgentId.isBlank()) {
            state.setDefaultAgentId(pathAgentId);
            registry.subscribe(connection.getId(), pathAgentId);
        }
    }

    public void onFrame(String connectionId, String frame) {
        InboundMessage message;
        try {
            message = codec.decode(frame);
        } catch (MalformedFrameException e) {
            log.warn("Closing connection {}: {}", connectionId, e.getMessage());
            registry.closeForBadData(connectionId, e.getMessage());
            return;
        } catch (ValidationException e) {
            sendError(connectionId, null, e.getAgentId(), e.getErrorType(), e.getMessage());
            return;
        }

        if (message.getType() == null) {
            sendError(connectionId, message.getRawType(), message.text("agent_id"), ErrorType.VALIDATION,
                "Unknown message type '" + message.getRawType() + "'");
            return;
        }
        if (message.getType().isAlias(message.getRawType())) {
            log.debug("Connection {} used deprecated type {} for {}",
                connectionId, message.getRawType(), message.getType().wireName());
        }

        ConnectionState state = registry.find(connectionId).orElse(null);
        if (state == null) {
            log.debug("Frame from closed connection {} dropped", connectionId);
            return;
        }

        try {
            dispatch(state, message);
        } catch (AgentOperationException e) {
            if (e instanceof NotFoundException && e.getAgentId() != null) {
                registry.unsubscribe(connectionId, e.getAgentId());
            }
            log.debug("{} from connection {} rejected: {}", message.getRawType(), connectionId, e.getMessage());
            sendError(connectionId, message.getRawType(), e.getAgentId() != null ? e.getAgentId() : message.text("agent_id"),
                e.getErrorType(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} from connection {} failed", message.getRawType(), connectionId, e);
            sendError(connectionId, message.getRawType(), message.text("agent_id"), ErrorType.INTERNAL,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Drops the connection's subscriptions. Agents keep running unless they were
     * created as connection-scoped.
     */
    public void onClose(String connectionId) {
        registry.unregister(connectionId);
        manager.releaseConnection(connectionId);
    }

    private void dispatch(ConnectionState state, InboundMessage message) {
        MessageType type = message.getType();
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("success", true);

        switch (type) {
            case CREATE_CONTRACT -> {
                ContractDefinition contract = manager.registerContract(codec.bind(message.getData(), ContractSpec.class));
                state.setLastContractId(contract.getContractId());
                reply.put("contract_id", contract.getContractId());
                reply.put("name", contract.getName());
                reply.put("address", contract.getAddress());
            }
            case CREATE_AGENT -> {
                AgentSpec spec = codec.bind(message.getData(), AgentSpec.class);
                String agentId = manager.create(spec, state.getId(), state.getLastContractId());
                adopt(state, agentId);
                reply.put("agent_id", agentId);
                reply.put("status", manager.statusOf(agentId));
            }
            case CREATE_FUNCTION -> {
                String agentId = subscribe(state, message);
                String functionId = manager.addFunction(agentId, codec.bind(message.getData(), FunctionSpec.class));
                reply.put("agent_id", agentId);
                reply.put("function_id", functionId);
            }
            case CREATE_SCHEDULE -> {
                String agentId = subscribe(state, message);
                Schedule schedule = manager.setSchedule(agentId, codec.bind(message.getData(), ScheduleSpec.class));
                reply.put("agent_id", agentId);
                reply.put("schedule_id", schedule.getScheduleId());
                reply.put("schedule", schedule);
            }
            case CREATE_NOTIFICATION -> {
                String agentId = subscribe(state, message);
                String notificationId = manager.addNotification(agentId, codec.bind(message.getData(), NotificationSpec.class));
                reply.put("agent_id", agentId);
                reply.put("notification_id", notificationId);
            }
            case CONFIGURE_AGENT -> {
                AgentView view;
                if (message.getData().has("agent") && message.getData().get("agent").isObject()) {
                    AgentDefinition definition = codec.bind(message.getData(), AgentDefinition.class);
                    String agentId = manager.materialize(definition, state.getId());
                    adopt(state, agentId);
                    view = manager.view(agentId);
                } else {
                    String agentId = subscribe(state, message);
                    view = manager.configure(agentId, codec.bind(message.getData(), AgentSpec.class));
                }
                reply.put("agent_id", view.getAgentId());
                reply.put("agent", view);
            }
            case START_AGENT -> putView(reply, manager.start(subscribe(state, message)));
            case STOP_AGENT -> putView(reply, manager.stop(subscribe(state, message)));
            case EXECUTE -> {
                // progress and result arrive as execution_response frames from the run itself
                manager.execute(subscribe(state, message));
                return;
            }
            case REMOVE_AGENT -> {
                String agentId = subscribe(state, message);
                manager.remove(agentId);
                reply.put("agent_id", agentId);
            }
            case LOAD_AGENT -> {
                String agentId = subscribe(state, message);
                manager.load(agentId, state.getId());
                adopt(state, agentId);
                reply.put("agent_id", agentId);
                reply.put("agent", manager.view(agentId));
            }
            case AGENT_STATUS -> {
                String agentId = subscribe(state, message);
                reply.put("agent_id", agentId);
                reply.put("agent", manager.view(agentId));
            }
            case LIST_AGENTS -> reply.put("agents", manager.list());
            case EXECUTION_HISTORY -> {
                String agentId = subscribe(state, message);
                int limit = message.getData().path("limit").asInt(DEFAULT_HISTORY_LIMIT);
                if (limit <= 0) {
                    throw new ValidationException("limit must be positive", agentId);
                }
                reply.put("agent_id", agentId);
                reply.put("records", manager.history(agentId, limit));
            }
        }

        registry.send(state.getId(), Envelope.of(type.responseType(), reply));
    }

    private String subscribe(ConnectionState state, InboundMessage message) {
        String agentId = message.text("agent_id");
        if (agentId == null) {
            agentId = state.getDefaultAgentId();
        }
        if (agentId == null) {
            throw new ValidationException(message.getRawType() + " needs an agent_id");
        }
        registry.subscribe(state.getId(), agentId);
        return agentId;
    }

    private void adopt(ConnectionState state, String agentId) {
        registry.subscribe(state.getId(), agentId);
        state.setDefaultAgentId(agentId);
    }

    private static void putView(Map<String, Object> reply, AgentView view) {
        reply.put("agent_id", view.getAgentId());
        reply.put("status", view.getStatus());
        reply.put("next_due_at", view.getNextDueAt());
    }

    private void sendError(String connectionId, String requestType, String agentId, ErrorType errorType, String text) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", false);
        data.put("error_type", errorType);
        data.put("message", text);
        data.put("request_type", requestType);
        data.put("agent_id", agentId);
        registry.send(connectionId, Envelope.of(OutboundType.ERROR, data));
    }
}
