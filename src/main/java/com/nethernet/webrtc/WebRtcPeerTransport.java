package com.nethernet.webrtc;

import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCDataChannel;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceConnectionState;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;

import com.nethernet.signaling.IceServer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * {@link PeerTransport} over a webrtc-java {@link RTCPeerConnection} on the answering side.
 *
 * <p>webrtc-java reports description steps through observers; each step is awaited here with the
 * negotiation timeout so callers see the synchronous contract.
 */
public class WebRtcPeerTransport implements PeerTransport {

    private static final Logger LOGGER = Logger.getLogger(WebRtcPeerTransport.class.getName());

    private final RTCPeerConnection peerConnection;
    private final long negotiationTimeoutSeconds;

    private volatile PeerTransportListener listener;
    private volatile boolean closed = false;

    WebRtcPeerTransport(PeerConnectionFactory factory, TransportConfig config, long negotiationTimeoutSeconds)
            throws TransportException {
        this.negotiationTimeoutSeconds = negotiationTimeoutSeconds;

        RTCConfiguration rtcConfig = new RTCConfiguration();
        rtcConfig.iceServers = toRtcIceServers(config.getIceServers());

        RTCPeerConnection pc;
        try {
            pc = factory.createPeerConnection(rtcConfig, new PeerConnectionObserver() {
                @Override
                public void onIceCandidate(RTCIceCandidate candidate) {
                    PeerTransportListener l = listener;
                    if (l != null) {
                        l.onLocalCandidate(candidate.sdp);
                    }
                }

                @Override
                public void onIceConnectionChange(RTCIceConnectionState state) {
                    LOGGER.fine("[WebRTC] ICE state: " + state);
                    PeerTransportListener l = listener;
                    if (l != null) {
                        l.onStateChange(IceState.from(state));
                    }
                }

                @Override
                public void onDataChannel(RTCDataChannel channel) {
                    PeerTransportListener l = listener;
                    if (l != null) {
                        l.onDataChannel(new WebRtcDataChannel(channel));
                    }
                }
            });
        } catch (RuntimeException e) {
            throw new TransportException("Failed to create peer connection: " + e.getMessage(), e);
        }
        if (pc == null) {
            throw new TransportException("Peer connection factory returned null");
        }
        this.peerConnection = pc;
        LOGGER.fine(String.format("[WebRTC] Peer connection created with %d ICE servers",
            rtcConfig.iceServers.size()));
    }

    @Override
    public void setListener(PeerTransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void setRemoteDescription(String sdp, SessionDescription.Kind kind) throws TransportException {
        ensureOpen();
        RTCSdpType type = kind == SessionDescription.Kind.OFFER ? RTCSdpType.OFFER : RTCSdpType.ANSWER;

        CompletableFuture<Void> remoteSet = new CompletableFuture<>();
        peerConnection.setRemoteDescription(new RTCSessionDescription(type, sdp), observerFor(remoteSet));
        await(remoteSet, "set remote " + kind.name().toLowerCase());

        if (kind != SessionDescription.Kind.OFFER) {
            return;
        }

        CompletableFuture<RTCSessionDescription> answer = new CompletableFuture<>();
        peerConnection.createAnswer(new RTCAnswerOptions(), new CreateSessionDescriptionObserver() {
            @Override
            public void onSuccess(RTCSessionDescription description) {
                answer.complete(description);
            }

            @Override
            public void onFailure(String error) {
                answer.completeExceptionally(new TransportException(error));
            }
        });
        RTCSessionDescription description = await(answer, "create answer");

        CompletableFuture<Void> localSet = new CompletableFuture<>();
        peerConnection.setLocalDescription(description, observerFor(localSet));
        await(localSet, "set local answer");
    }

    @Override
    public SessionDescription localDescription() {
        if (closed) {
            return null;
        }
        RTCSessionDescription description = peerConnection.getLocalDescription();
        if (description == null) {
            return null;
        }
        SessionDescription.Kind kind;
        if (description.sdpType == RTCSdpType.ANSWER) {
            kind = SessionDescription.Kind.ANSWER;
        } else if (description.sdpType == RTCSdpType.OFFER) {
            kind = SessionDescription.Kind.OFFER;
        } else {
            return null;
        }
        return new SessionDescription(kind, description.sdp);
    }

    @Override
    public void addRemoteCandidate(String candidate, String mid) throws TransportException {
        ensureOpen();
        try {
            peerConnection.addIceCandidate(new RTCIceCandidate(mid, parseLineIndex(mid), candidate));
        } catch (RuntimeException e) {
            throw new TransportException("Failed to add remote candidate: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws TransportException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            peerConnection.close();
        } catch (RuntimeException e) {
            throw new TransportException("Failed to close peer connection: " + e.getMessage(), e);
        }
    }

    private void ensureOpen() throws TransportException {
        if (closed) {
            throw new TransportException("Peer connection already closed");
        }
    }

    private static SetSessionDescriptionObserver observerFor(CompletableFuture<Void> future) {
        return new SetSessionDescriptionObserver() {
            @Override
            public void onSuccess() {
                future.complete(null);
            }

            @Override
            public void onFailure(String error) {
                future.completeExceptionally(new TransportException(error));
            }
        };
    }

    private <T> T await(CompletableFuture<T> future, String step) throws TransportException {
        try {
            return future.get(negotiationTimeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new TransportException("Failed to " + step + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException("Timed out trying to " + step, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted trying to " + step, e);
        }
    }

    private static int parseLineIndex(String mid) {
        try {
            return Integer.parseInt(mid);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<RTCIceServer> toRtcIceServers(List<IceServer> servers) {
        List<RTCIceServer> result = new ArrayList<>();
        for (IceServer server : servers) {
            RTCIceServer rtcServer = new RTCIceServer();
            rtcServer.urls.addAll(server.getUrls());
            if (server.getUsername() != null) {
                rtcServer.username = server.getUsername();
            }
            if (server.getCredential() != null) {
                rtcServer.password = server.getCredential();
            }
            result.add(rtcServer);
        }
        return result;
    }
}
