package com.nethernet.server;

import com.nethernet.signaling.IceServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class HostConfigTest {

    @AfterEach
    public void clearOverrides() {
        System.clearProperty(HostConfig.RELAY_PORT);
    }

    @Test
    public void testLoad_ReadsClasspathResource() {
        HostConfig config = HostConfig.load();

        assertEquals("127.0.0.1", config.getRelayHost());
        assertEquals(50051, config.getRelayPort());
        assertTrue(config.isBufferEarlyCandidates());
        assertEquals(List.of(IceServer.stun("stun:stun.test:19302")), config.getIceServers());
    }

    @Test
    public void testLoad_SystemPropertyOverrides() {
        System.setProperty(HostConfig.RELAY_PORT, "6000");

        assertEquals(6000, HostConfig.load().getRelayPort());
    }

    @Test
    public void testDefaults() {
        HostConfig config = HostConfig.defaults();

        assertEquals("127.0.0.1", config.getRelayHost());
        assertEquals(50051, config.getRelayPort());
        assertEquals(10, config.getNegotiationTimeoutSeconds());
        assertEquals(1024, config.getMaxPendingConnections());
        assertEquals(64, config.getMaxCandidatesPerConnection());
        assertEquals(1, config.getIceServers().size());
    }

    @Test
    public void testStunUrls_SplitAndTrimmed() {
        Properties props = new Properties();
        props.setProperty(HostConfig.STUN_URLS, " stun:a:1 , stun:b:2,,");

        assertEquals(List.of(IceServer.stun("stun:a:1"), IceServer.stun("stun:b:2")),
            HostConfig.fromProperties(props).getIceServers());
    }

    @Test
    public void testInvalidNumber_Rejected() {
        Properties props = new Properties();
        props.setProperty(HostConfig.MAX_PER_CONNECTION, "many");

        assertThrows(IllegalArgumentException.class, () -> HostConfig.fromProperties(props));

        props.setProperty(HostConfig.MAX_PER_CONNECTION, "0");
        assertThrows(IllegalArgumentException.class, () -> HostConfig.fromProperties(props));
    }
}
