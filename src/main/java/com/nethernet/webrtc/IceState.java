package com.nethernet.webrtc;

import dev.onvoid.webrtc.RTCIceConnectionState;

/**
 * ICE connectivity state reported by a peer transport.
 */
public enum IceState {
    NEW,
    CHECKING,
    CONNECTED,
    COMPLETED,
    DISCONNECTED,
    FAILED,
    CLOSED;

    public boolean isConnected() {
        return this == CONNECTED || this == COMPLETED;
    }

    /**
     * Disconnected, failed and closed: no further progress toward a connection is expected.
     */
    public boolean isTerminal() {
        return this == DISCONNECTED || this == FAILED || this == CLOSED;
    }

    /**
     * @return the lower-case reason string passed to close notifications
     */
    public String reason() {
        return name().toLowerCase();
    }

    static IceState from(RTCIceConnectionState state) {
        try {
            return valueOf(state.name());
        } catch (IllegalArgumentException e) {
            return NEW;
        }
    }
}
