package com.zephyrus.agent.exception;

public class NotFoundException extends AgentOperationException {

    public NotFoundException(String message) {
        super(message, null);
    }

    public NotFoundException(String message, String agentId) {
        super(message, agentId);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.NOT_FOUND;
    }
}
