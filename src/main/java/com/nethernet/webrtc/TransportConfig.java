package com.nethernet.webrtc;

import com.nethernet.signaling.IceServer;

import java.util.List;

/**
 * Settings for one new peer transport.
 */
public final class TransportConfig {

    private final List<IceServer> iceServers;

    public TransportConfig(List<IceServer> iceServers) {
        this.iceServers = List.copyOf(iceServers);
    }

    public List<IceServer> getIceServers() {
        return iceServers;
    }
}
