package com.nethernet.webrtc;

import java.nio.ByteBuffer;

/**
 * One data channel opened by the remote peer on a transport.
 */
public interface DataChannel {

    String getLabel();

    boolean isOpen();

    /**
     * Sends one binary message.
     */
    void send(ByteBuffer message) throws TransportException;

    /**
     * Registers the observer; replaces any earlier one.
     */
    void setObserver(DataChannelObserver observer);

    void close();
}
