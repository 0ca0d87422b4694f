package com.nethernet.signaling;

import com.nethernet.grpc.NetherNetProto.SignalFrame;
import com.nethernet.grpc.NetherNetProto.SignalFrame.FrameType;
import com.nethernet.grpc.SignalingRelayGrpc;

import io.grpc.stub.StreamObserver;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Relay side of the signaling stream: one registered stream per network id, SIGNAL frames are
 * forwarded to the addressed network id with {@code network_id} rewritten to the sender.
 */
public class SignalingRelayService extends SignalingRelayGrpc.SignalingRelayImplBase {

    private static final Logger LOGGER = Logger.getLogger(SignalingRelayService.class.getName());

    // networkId -> outbound stream of that host
    private final Map<Long, StreamObserver<SignalFrame>> signalingStreams = new ConcurrentHashMap<>();
    private final List<IceServer> iceServers;

    public SignalingRelayService(List<IceServer> iceServers) {
        this.iceServers = List.copyOf(iceServers);
    }

    @Override
    public StreamObserver<SignalFrame> streamSignals(StreamObserver<SignalFrame> responseObserver) {
        return new StreamObserver<SignalFrame>() {
            private Long networkId = null;

            @Override
            public void onNext(SignalFrame frame) {
                if (frame.getType() == FrameType.REGISTER) {
                    networkId = frame.getNetworkId();
                    StreamObserver<SignalFrame> previous = signalingStreams.put(networkId, responseObserver);
                    if (previous != null && previous != responseObserver) {
                        LOGGER.warning("[Relay] Network " + Long.toUnsignedString(networkId)
                            + " re-registered, replacing previous stream");
                    }
                    send(responseObserver, SignalFrames.credentials(iceServers));
                    LOGGER.info("[Relay] Registered network " + Long.toUnsignedString(networkId));
                    return;
                }

                if (frame.getType() != FrameType.SIGNAL) {
                    LOGGER.fine("[Relay] Ignoring frame of type " + frame.getType());
                    return;
                }

                if (networkId == null) {
                    send(responseObserver, SignalFrames.error("Not registered"));
                    return;
                }

                long target = frame.getNetworkId();
                StreamObserver<SignalFrame> targetStream = signalingStreams.get(target);
                if (targetStream == null) {
                    LOGGER.warning("[Relay] Target network not connected: " + Long.toUnsignedString(target));
                    send(responseObserver, SignalFrames.error(
                        "Target not connected: " + Long.toUnsignedString(target)));
                    return;
                }

                send(targetStream, frame.toBuilder().setNetworkId(networkId).build());
            }

            @Override
            public void onError(Throwable t) {
                LOGGER.fine("[Relay] Stream error: " + t.getMessage());
                unregister();
            }

            @Override
            public void onCompleted() {
                unregister();
                responseObserver.onCompleted();
            }

            private void unregister() {
                if (networkId != null) {
                    signalingStreams.remove(networkId, responseObserver);
                    LOGGER.info("[Relay] Unregistered network " + Long.toUnsignedString(networkId));
                }
            }
        };
    }

    public boolean isRegistered(long networkId) {
        return signalingStreams.containsKey(networkId);
    }

    // StreamObserver is not thread-safe; several senders may forward into one stream
    private static void send(StreamObserver<SignalFrame> stream, SignalFrame frame) {
        synchronized (stream) {
            try {
                stream.onNext(frame);
            } catch (RuntimeException e) {
                LOGGER.warning("[Relay] Failed to deliver " + frame.getType() + ": " + e.getMessage());
            }
        }
    }
}
