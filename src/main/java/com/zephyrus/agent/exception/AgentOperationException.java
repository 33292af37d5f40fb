package com.zephyrus.agent.exception;

/**
 * Client-visible failure of an agent manager operation. Converted into an
 * {@code error} frame by the protocol handler.
 */
public abstract class AgentOperationException extends RuntimeException {

    private final String agentId;

    protected AgentOperationException(String message, String agentId) {
        super(message);
        this.agentId = agentId;
    }

    public abstract ErrorType getErrorType();

    public String getAgentId() {
        return agentId;
    }
}
