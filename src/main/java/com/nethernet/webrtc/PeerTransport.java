package com.nethernet.webrtc;

/**
 * The real-time engine under one NetherNet connection: ICE, DTLS and SCTP live behind this.
 *
 * <p>Calls are synchronous. Applying a remote offer also produces the local answer, which is then
 * readable through {@link #localDescription()}.
 */
public interface PeerTransport {

    void setListener(PeerTransportListener listener);

    void setRemoteDescription(String sdp, SessionDescription.Kind kind) throws TransportException;

    /**
     * @return the applied local description, or {@code null} if none was produced
     */
    SessionDescription localDescription();

    /**
     * @throws TransportException if the candidate is rejected or the session is already torn down
     */
    void addRemoteCandidate(String candidate, String mid) throws TransportException;

    void close() throws TransportException;
}
