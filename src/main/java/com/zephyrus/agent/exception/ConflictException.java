package com.zephyrus.agent.exception;

/**
 * The operation is not valid for the agent's current status.
 */
public class ConflictException extends AgentOperationException {

    public ConflictException(String message) {
        super(message, null);
    }

    public ConflictException(String message, String agentId) {
        super(message, agentId);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.CONFLICT;
    }
}
