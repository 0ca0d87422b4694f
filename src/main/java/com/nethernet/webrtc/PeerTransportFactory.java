package com.nethernet.webrtc;

@FunctionalInterface
public interface PeerTransportFactory {

    PeerTransport create(TransportConfig config) throws TransportException;
}
