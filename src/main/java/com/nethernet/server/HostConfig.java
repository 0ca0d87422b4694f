package com.nethernet.server;

import com.nethernet.signaling.IceServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Host settings, read from {@code nethernet.properties} on the classpath. Any key can be
 * overridden with a {@code -D} system property of the same name.
 */
public final class HostConfig {

    public static final String RESOURCE = "nethernet.properties";

    static final String RELAY_HOST = "nethernet.relay.host";
    static final String RELAY_PORT = "nethernet.relay.port";
    static final String RELAY_CONNECT_TIMEOUT = "nethernet.relay.connectTimeoutSeconds";
    static final String NEGOTIATION_TIMEOUT = "nethernet.negotiation.timeoutSeconds";
    static final String BUFFER_EARLY = "nethernet.candidates.bufferEarly";
    static final String MAX_PENDING_CONNECTIONS = "nethernet.candidates.maxPendingConnections";
    static final String MAX_PER_CONNECTION = "nethernet.candidates.maxPerConnection";
    static final String STUN_URLS = "nethernet.ice.stunUrls";

    private final String relayHost;
    private final int relayPort;
    private final long relayConnectTimeoutSeconds;
    private final long negotiationTimeoutSeconds;
    private final boolean bufferEarlyCandidates;
    private final int maxPendingConnections;
    private final int maxCandidatesPerConnection;
    private final List<IceServer> iceServers;

    private HostConfig(Properties props) {
        this.relayHost = props.getProperty(RELAY_HOST, "127.0.0.1").trim();
        this.relayPort = intValue(props, RELAY_PORT, 50051);
        this.relayConnectTimeoutSeconds = intValue(props, RELAY_CONNECT_TIMEOUT, 10);
        this.negotiationTimeoutSeconds = intValue(props, NEGOTIATION_TIMEOUT, 10);
        this.bufferEarlyCandidates = Boolean.parseBoolean(props.getProperty(BUFFER_EARLY, "true").trim());
        this.maxPendingConnections = intValue(props, MAX_PENDING_CONNECTIONS, 1024);
        this.maxCandidatesPerConnection = intValue(props, MAX_PER_CONNECTION, 64);
        this.iceServers = stunServers(props.getProperty(STUN_URLS, "stun:stun.l.google.com:19302"));
    }

    /**
     * Classpath resource, then system properties on top.
     */
    public static HostConfig load() {
        Properties props = new Properties();
        try (InputStream in = HostConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("nethernet.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return new HostConfig(props);
    }

    /**
     * Missing keys take their defaults.
     */
    public static HostConfig fromProperties(Properties props) {
        return new HostConfig(props);
    }

    public static HostConfig defaults() {
        return new HostConfig(new Properties());
    }

    public String getRelayHost() {
        return relayHost;
    }

    public int getRelayPort() {
        return relayPort;
    }

    public long getRelayConnectTimeoutSeconds() {
        return relayConnectTimeoutSeconds;
    }

    public long getNegotiationTimeoutSeconds() {
        return negotiationTimeoutSeconds;
    }

    /**
     * Whether a candidate for an identifier with no offer yet opens a pending bucket.
     */
    public boolean isBufferEarlyCandidates() {
        return bufferEarlyCandidates;
    }

    public int getMaxPendingConnections() {
        return maxPendingConnections;
    }

    public int getMaxCandidatesPerConnection() {
        return maxCandidatesPerConnection;
    }

    public List<IceServer> getIceServers() {
        return iceServers;
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException("Value for " + key + " must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static List<IceServer> stunServers(String urls) {
        List<IceServer> servers = new ArrayList<>();
        for (String url : urls.split(",")) {
            if (!url.isBlank()) {
                servers.add(IceServer.stun(url.trim()));
            }
        }
        return List.copyOf(servers);
    }
}
