package com.zephyrus.agent.client;

/**
 * The contract or node rejected the call.
 */
public class ContractRevertedException extends RuntimeException {

    public ContractRevertedException(String message) {
        super(message);
    }

    public ContractRevertedException(String message, Throwable cause) {
        super(message, cause);
    }
}
