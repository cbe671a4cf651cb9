package com.bbthechange.carshare.websocket;

import java.io.IOException;

/**
 * One open connection of the persistent channel, as seen by the dispatcher.
 */
public interface ChannelConnection {

    String getId();

    boolean isOpen();

    /**
     * Send one text frame. Safe to call from several threads.
     */
    void send(String text) throws IOException;

    void close();
}
