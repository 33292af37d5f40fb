package com.zephyrus.agent.exception;

/**
 * Malformed or out-of-range input; the client can correct and retry.
 */
public class ValidationException extends AgentOperationException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, String agentId) {
        super(message, agentId);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.VALIDATION;
    }
}
