package com.zephyrus.agent.exception;

public class PreconditionException extends AgentOperationException {

    public PreconditionException(String message) {
        super(message, null);
    }

    public PreconditionException(String message, String agentId) {
        super(message, agentId);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.PRECONDITION;
    }
}
