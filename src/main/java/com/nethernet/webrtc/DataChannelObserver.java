package com.nethernet.webrtc;

import java.nio.ByteBuffer;

public interface DataChannelObserver {

    void onOpen();

    /**
     * @param message a copy the observer may keep
     */
    void onMessage(ByteBuffer message);

    void onClose();
}
