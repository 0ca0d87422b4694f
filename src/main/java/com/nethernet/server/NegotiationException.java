package com.nethernet.server;

import com.nethernet.NetherNetException;

/**
 * An offer could not be turned into an answer. Not retried.
 */
public class NegotiationException extends NetherNetException {

    private final long connectionId;

    public NegotiationException(long connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public long getConnectionId() {
        return connectionId;
    }
}
