package com.nethernet.webrtc;

/**
 * Events raised by a peer transport. Called from transport threads; implementations should hand
 * the work off rather than block.
 */
public interface PeerTransportListener {

    /**
     * A local ICE candidate was gathered.
     */
    void onLocalCandidate(String candidate);

    /**
     * The remote peer opened a data channel.
     */
    void onDataChannel(DataChannel channel);

    void onStateChange(IceState state);
}
