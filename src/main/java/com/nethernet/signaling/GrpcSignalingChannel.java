package com.nethernet.signaling;

import com.nethernet.grpc.NetherNetProto.SignalFrame;
import com.nethernet.grpc.SignalingRelayGrpc;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.stub.StreamObserver;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Signaling channel over a bidirectional gRPC stream to a {@link SignalingRelayService}.
 *
 * <p>{@link #connect()} registers this host's network id and blocks until the relay answers with
 * the ICE server credentials. Inbound SIGNAL frames are parsed and handed to the callback on the
 * gRPC executor thread.
 */
public class GrpcSignalingChannel implements SignalingChannel {

    private static final Logger LOGGER = Logger.getLogger(GrpcSignalingChannel.class.getName());

    private final ManagedChannel channel;
    private final boolean ownsChannel;
    private final SignalingRelayGrpc.SignalingRelayStub asyncStub;
    private final long networkId;
    private final long connectTimeoutSeconds;

    private StreamObserver<SignalFrame> signalingStreamOut;
    private volatile boolean streamActive = false;
    private volatile CompletableFuture<Void> registration;

    private volatile List<IceServer> credentials;
    private volatile Consumer<SignalStructure> onSignalCallback;

    public GrpcSignalingChannel(String host, int port, long networkId, long connectTimeoutSeconds) {
        this(ManagedChannelBuilder.forAddress(host, port).usePlaintext().build(),
            true, networkId, connectTimeoutSeconds);
        LOGGER.info(String.format("[Signaling] Channel to %s:%d initialized", host, port));
    }

    /**
     * Uses a caller-managed channel; {@link #close()} leaves it open.
     */
    public GrpcSignalingChannel(ManagedChannel channel, long networkId, long connectTimeoutSeconds) {
        this(channel, false, networkId, connectTimeoutSeconds);
    }

    private GrpcSignalingChannel(ManagedChannel channel, boolean ownsChannel, long networkId,
                                 long connectTimeoutSeconds) {
        this.channel = channel;
        this.ownsChannel = ownsChannel;
        this.asyncStub = SignalingRelayGrpc.newStub(channel);
        this.networkId = networkId;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    @Override
    public synchronized void connect() throws SignalingException {
        if (streamActive) {
            LOGGER.fine("[Signaling] Stream already active");
            return;
        }

        CompletableFuture<Void> registered = new CompletableFuture<>();
        this.registration = registered;

        StreamObserver<SignalFrame> streamIn = new StreamObserver<SignalFrame>() {
            @Override
            public void onNext(SignalFrame frame) {
                handleFrame(frame);
            }

            @Override
            public void onError(Throwable t) {
                LOGGER.warning("[Signaling] Stream error: " + t.getMessage());
                streamActive = false;
                registered.completeExceptionally(t);
            }

            @Override
            public void onCompleted() {
                LOGGER.info("[Signaling] Stream completed by relay");
                streamActive = false;
                registered.completeExceptionally(new SignalingException("Relay closed the stream"));
            }
        };

        try {
            signalingStreamOut = asyncStub.streamSignals(streamIn);
            signalingStreamOut.onNext(SignalFrames.register(networkId));
        } catch (RuntimeException e) {
            throw new SignalingException("Failed to open signaling stream: " + e.getMessage(), e);
        }

        try {
            registered.get(connectTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            stopSignalingStream();
            throw new SignalingException("Timed out waiting for relay credentials", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            signalingStreamOut = null;
            throw new SignalingException("Relay rejected registration: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopSignalingStream();
            throw new SignalingException("Interrupted while connecting to relay", e);
        }

        streamActive = true;
        LOGGER.info(String.format("[Signaling] Registered as network %s",
            Long.toUnsignedString(networkId)));
    }

    private void handleFrame(SignalFrame frame) {
        switch (frame.getType()) {
            case CREDENTIALS:
                credentials = SignalFrames.fromProto(frame.getIceServersList());
                LOGGER.fine("[Signaling] Received credentials: " + credentials);
                registration.complete(null);
                break;

            case SIGNAL:
                SignalStructure signal;
                try {
                    signal = SignalStructure.fromString(frame.getMessage(), frame.getNetworkId());
                } catch (IllegalArgumentException e) {
                    LOGGER.warning("[Signaling] Dropping malformed signal: " + e.getMessage());
                    return;
                }
                Consumer<SignalStructure> callback = onSignalCallback;
                if (callback != null) {
                    callback.accept(signal);
                } else {
                    LOGGER.fine("[Signaling] No handler subscribed, dropping " + signal.getType());
                }
                break;

            case ERROR:
                if (!registration.isDone()) {
                    registration.completeExceptionally(new SignalingException(frame.getMessage()));
                } else {
                    LOGGER.warning("[Signaling] Relay error: " + frame.getMessage());
                }
                break;

            default:
                LOGGER.fine("[Signaling] Ignoring frame of type " + frame.getType());
        }
    }

    @Override
    public synchronized void write(SignalStructure signal) throws SignalingException {
        if (!streamActive || signalingStreamOut == null) {
            throw new SignalingException("Signaling stream not active");
        }
        try {
            signalingStreamOut.onNext(SignalFrames.signal(signal));
        } catch (RuntimeException e) {
            throw new SignalingException("Failed to send " + signal.getType() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setOnSignalCallback(Consumer<SignalStructure> callback) {
        this.onSignalCallback = callback;
    }

    @Override
    public List<IceServer> getCredentials() {
        return credentials;
    }

    public boolean isStreamActive() {
        return streamActive;
    }

    private synchronized void stopSignalingStream() {
        if (signalingStreamOut == null) {
            return;
        }
        try {
            signalingStreamOut.onCompleted();
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "[Signaling] Error completing stream", e);
        }
        signalingStreamOut = null;
        streamActive = false;
    }

    @Override
    public void close() {
        LOGGER.info("[Signaling] Shutting down...");
        stopSignalingStream();

        if (ownsChannel && !channel.isShutdown()) {
            channel.shutdown();
            try {
                channel.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                channel.shutdownNow();
            }
        }
    }
}
