package com.nethernet.signaling;

import java.util.List;
import java.util.function.Consumer;

/**
 * Out-of-band path that carries offers, answers and candidates between this host and remote peers.
 */
public interface SignalingChannel {

    /**
     * Establishes the channel. Fails if the signaling service is unreachable or rejects the host.
     */
    void connect() throws SignalingException;

    /**
     * Sends one signal to the network id it carries.
     */
    void write(SignalStructure signal) throws SignalingException;

    /**
     * Subscribes the consumer of inbound signals. Only one handler is kept.
     */
    void setOnSignalCallback(Consumer<SignalStructure> callback);

    /**
     * @return the current ICE servers, or {@code null} until the service has provided them
     */
    List<IceServer> getCredentials();

    void close();
}
