package com.zephyrus.agent.client;

/**
 * The call never reached the contract (connection refused, gateway error).
 */
public class CallTransportException extends RuntimeException {

    public CallTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
