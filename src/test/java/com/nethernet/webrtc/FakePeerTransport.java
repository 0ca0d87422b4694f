package com.nethernet.webrtc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scriptable in-memory transport. Records every call in {@link #log} in order.
 */
public class FakePeerTransport implements PeerTransport {

    public final TransportConfig config;
    public final List<String> log = new ArrayList<>();
    public final List<String> appliedCandidates = new ArrayList<>();
    public final List<String> appliedMids = new ArrayList<>();
    public final Set<String> failingCandidates = new HashSet<>();

    public SessionDescription answer = new SessionDescription(SessionDescription.Kind.ANSWER, "v=0 answer");
    public boolean rejectOffer = false;
    public boolean closed = false;
    public int closeCount = 0;

    private PeerTransportListener listener;
    private boolean remoteSet = false;

    public FakePeerTransport(TransportConfig config) {
        this.config = config;
    }

    @Override
    public void setListener(PeerTransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void setRemoteDescription(String sdp, SessionDescription.Kind kind) throws TransportException {
        log.add("remote:" + kind + ":" + sdp);
        if (rejectOffer) {
            throw new TransportException("Malformed offer");
        }
        remoteSet = true;
    }

    @Override
    public SessionDescription localDescription() {
        return remoteSet ? answer : null;
    }

    @Override
    public void addRemoteCandidate(String candidate, String mid) throws TransportException {
        if (closed) {
            throw new TransportException("Transport closed");
        }
        if (failingCandidates.contains(candidate)) {
            throw new TransportException("Rejected candidate " + candidate);
        }
        log.add("candidate:" + candidate);
        appliedCandidates.add(candidate);
        appliedMids.add(mid);
    }

    @Override
    public void close() {
        closed = true;
        closeCount++;
    }

    public void fireLocalCandidate(String candidate) {
        listener.onLocalCandidate(candidate);
    }

    public void fireDataChannel(DataChannel channel) {
        listener.onDataChannel(channel);
    }

    public void fireStateChange(IceState state) {
        listener.onStateChange(state);
    }
}
