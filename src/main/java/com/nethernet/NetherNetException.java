package com.nethernet;

/**
 * Base of the checked failures raised while negotiating NetherNet connections.
 */
public class NetherNetException extends Exception {

    public NetherNetException(String message) {
        super(message);
    }

    public NetherNetException(String message, Throwable cause) {
        super(message, cause);
    }
}
