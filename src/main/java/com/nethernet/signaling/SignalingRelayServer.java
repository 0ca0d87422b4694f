package com.nethernet.signaling;

import com.nethernet.server.HostConfig;

import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.netty.shaded.io.netty.channel.ChannelOption;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Netty-hosted {@link SignalingRelayService}.
 */
public class SignalingRelayServer {

    private static final Logger LOGGER = Logger.getLogger(SignalingRelayServer.class.getName());

    private final int port;
    private final List<IceServer> iceServers;
    private Server server;

    public SignalingRelayServer(int port, List<IceServer> iceServers) {
        this.port = port;
        this.iceServers = iceServers;
    }

    public void start() throws IOException {
        server = NettyServerBuilder
            .forAddress(new InetSocketAddress(port))
            .addService(new SignalingRelayService(iceServers))
            .withChildOption(ChannelOption.SO_REUSEADDR, true)
            .withOption(ChannelOption.SO_REUSEADDR, true)
            .keepAliveTime(20, TimeUnit.SECONDS)
            .keepAliveTimeout(10, TimeUnit.SECONDS)
            .permitKeepAliveTime(10, TimeUnit.SECONDS)
            .permitKeepAliveWithoutCalls(true)
            .build()
            .start();
        LOGGER.info("[Relay] gRPC signaling relay started on port " + port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("[Relay] Shutting down gRPC server (JVM shutdown)");
            try {
                shutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
    }

    public void shutdown() throws InterruptedException {
        if (server != null) {
            server.shutdown().awaitTermination(30, TimeUnit.SECONDS);
        }
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    public static void main(String[] args) throws Exception {
        HostConfig config = HostConfig.load();
        SignalingRelayServer relay = new SignalingRelayServer(config.getRelayPort(), config.getIceServers());
        relay.start();
        relay.blockUntilShutdown();
    }
}
