package com.zephyrus.agent.protocol;

/**
 * The frame is not a JSON object with a string {@code type}. The connection is
 * closed rather than answered.
 */
public class MalformedFrameException extends Exception {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
