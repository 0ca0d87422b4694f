package com.nethernet.webrtc;

import com.nethernet.NetherNetException;

/**
 * A peer transport operation failed, most often because the session is already torn down.
 */
public class TransportException extends NetherNetException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
