package com.zephyrus.agent.client;

/**
 * The gateway rejected the function or ABI itself. Retrying the same
 * configuration cannot succeed.
 */
public class InterfaceRejectedException extends ContractRevertedException {

    public InterfaceRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
