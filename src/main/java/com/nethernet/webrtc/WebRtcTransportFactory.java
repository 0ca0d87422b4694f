package com.nethernet.webrtc;

import dev.onvoid.webrtc.PeerConnectionFactory;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates {@link WebRtcPeerTransport}s from one shared {@link PeerConnectionFactory}.
 */
public class WebRtcTransportFactory implements PeerTransportFactory, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WebRtcTransportFactory.class.getName());

    private final PeerConnectionFactory factory;
    private final long negotiationTimeoutSeconds;

    /**
     * Loads the native WebRTC library.
     *
     * @throws TransportException if the native library is not available on this platform
     */
    public WebRtcTransportFactory(long negotiationTimeoutSeconds) throws TransportException {
        LOGGER.info("[WebRTC] Initializing WebRTC with native library...");
        try {
            this.factory = new PeerConnectionFactory();
        } catch (Throwable e) {
            throw new TransportException("Native WebRTC library failed to load: " + e.getMessage(), e);
        }
        this.negotiationTimeoutSeconds = negotiationTimeoutSeconds;
        LOGGER.info("[WebRTC] WebRTC initialized");
    }

    @Override
    public PeerTransport create(TransportConfig config) throws TransportException {
        return new WebRtcPeerTransport(factory, config, negotiationTimeoutSeconds);
    }

    @Override
    public void close() {
        try {
            factory.dispose();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[WebRTC] Error disposing factory", e);
        }
        LOGGER.info("[WebRTC] WebRTC shutdown complete");
    }
}
