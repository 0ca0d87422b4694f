package com.nethernet.signaling;

import com.nethernet.grpc.NetherNetProto;
import com.nethernet.grpc.NetherNetProto.SignalFrame;
import com.nethernet.grpc.NetherNetProto.SignalFrame.FrameType;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders and converters for relay frames.
 */
final class SignalFrames {

    private SignalFrames() {}

    static SignalFrame register(long networkId) {
        return SignalFrame.newBuilder()
            .setType(FrameType.REGISTER)
            .setNetworkId(networkId)
            .setTimestamp(System.currentTimeMillis())
            .build();
    }

    static SignalFrame signal(SignalStructure signal) {
        return SignalFrame.newBuilder()
            .setType(FrameType.SIGNAL)
            .setNetworkId(signal.getNetworkId())
            .setMessage(signal.toString())
            .setTimestamp(System.currentTimeMillis())
            .build();
    }

    static SignalFrame credentials(List<IceServer> iceServers) {
        SignalFrame.Builder builder = SignalFrame.newBuilder()
            .setType(FrameType.CREDENTIALS)
            .setTimestamp(System.currentTimeMillis());
        for (IceServer server : iceServers) {
            builder.addIceServers(toProto(server));
        }
        return builder.build();
    }

    static SignalFrame error(String reason) {
        return SignalFrame.newBuilder()
            .setType(FrameType.ERROR)
            .setMessage(reason)
            .setTimestamp(System.currentTimeMillis())
            .build();
    }

    static NetherNetProto.IceServer toProto(IceServer server) {
        NetherNetProto.IceServer.Builder builder = NetherNetProto.IceServer.newBuilder()
            .addAllUrls(server.getUrls());
        if (server.getUsername() != null) {
            builder.setUsername(server.getUsername());
        }
        if (server.getCredential() != null) {
            builder.setCredential(server.getCredential());
        }
        return builder.build();
    }

    static List<IceServer> fromProto(List<NetherNetProto.IceServer> servers) {
        List<IceServer> result = new ArrayList<>(servers.size());
        for (NetherNetProto.IceServer server : servers) {
            result.add(new IceServer(
                server.getUrlsList(),
                server.getUsername().isEmpty() ? null : server.getUsername(),
                server.getCredential().isEmpty() ? null : server.getCredential()));
        }
        return List.copyOf(result);
    }
}
