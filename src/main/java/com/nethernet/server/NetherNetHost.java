package com.nethernet.server;

import com.nethernet.signaling.GrpcSignalingChannel;
import com.nethernet.webrtc.WebRtcTransportFactory;

import java.util.logging.Logger;

/**
 * Starts a NetherNet host against the configured signaling relay.
 */
public class NetherNetHost {

    private static final Logger LOGGER = Logger.getLogger(NetherNetHost.class.getName());

    public static void main(String[] args) throws Exception {
        HostConfig config = HostConfig.load();
        long networkId = NetherNetServer.randomId();

        WebRtcTransportFactory transports = new WebRtcTransportFactory(config.getNegotiationTimeoutSeconds());
        GrpcSignalingChannel signaling = new GrpcSignalingChannel(
            config.getRelayHost(), config.getRelayPort(), networkId, config.getRelayConnectTimeoutSeconds());
        NetherNetServer server = new NetherNetServer(
            signaling, transports, config, networkId, NetherNetServer.randomId());

        server.setOnOpenConnection(connection ->
            LOGGER.info("[Host] Peer connected: " + Long.toUnsignedString(connection.getConnectionId())));
        server.setOnCloseConnection((id, reason) ->
            LOGGER.info("[Host] Peer disconnected: " + Long.toUnsignedString(id) + " (" + reason + ")"));
        server.setOnEncapsulated((packet, id) ->
            LOGGER.fine("[Host] " + packet.length + " bytes from " + Long.toUnsignedString(id)));

        try {
            server.listen();
        } catch (Exception e) {
            signaling.close();
            transports.close();
            throw e;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("[Host] Shutting down (JVM shutdown)");
            server.close();
            signaling.close();
            transports.close();
        }));

        LOGGER.info(String.format("[Host] NetherNet host started: network %s via %s:%d",
            Long.toUnsignedString(networkId), config.getRelayHost(), config.getRelayPort()));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            LOGGER.info("[Host] Interrupted, shutting down...");
        }
    }
}
