package com.nethernet.signaling;

import com.nethernet.NetherNetException;

/**
 * The signaling channel is unreachable, rejected the host, or is not connected.
 */
public class SignalingException extends NetherNetException {

    public SignalingException(String message) {
        super(message);
    }

    public SignalingException(String message, Throwable cause) {
        super(message, cause);
    }
}
