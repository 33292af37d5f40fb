package com.zephyrus.agent.connection;

import java.io.IOException;

/**
 * Transport-neutral view of one live client channel.
 */
public interface ClientConnection {

    String getId();

    boolean isOpen();

    void send(String frame) throws IOException;

    /**
     * Closes the channel because the peer sent data that could not be decoded.
     */
    void closeForBadData(String reason) throws IOException;
}
