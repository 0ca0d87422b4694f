package com.nethernet.server;

import com.nethernet.p2p.Connection;
import com.nethernet.webrtc.FakePeerTransport;
import com.nethernet.webrtc.TransportConfig;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionRegistryTest {

    private static Connection connection(long id) {
        return new Connection(id, new FakePeerTransport(new TransportConfig(List.of())), Runnable::run, (p, i) -> {});
    }

    @Test
    public void testRegisterLookupUnregister() {
        ConnectionRegistry registry = new ConnectionRegistry();
        Connection c = connection(42);

        assertNull(registry.register(42, c));
        assertSame(c, registry.lookup(42));
        assertNull(registry.lookup(43));

        assertTrue(registry.unregister(42));
        assertFalse(registry.unregister(42));
        assertNull(registry.lookup(42));
    }

    @Test
    public void testRegister_OverwritesAndReturnsPrevious() {
        ConnectionRegistry registry = new ConnectionRegistry();
        Connection first = connection(1);
        Connection second = connection(1);

        registry.register(1, first);

        assertSame(first, registry.register(1, second));
        assertFalse(registry.unregister(1, first));
        assertSame(second, registry.lookup(1));
        assertTrue(registry.unregister(1, second));
    }

    @Test
    public void testValues_IsSnapshot() {
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.register(1, connection(1));
        registry.register(2, connection(2));

        List<Connection> snapshot = registry.values();
        registry.clear();

        assertEquals(2, snapshot.size());
        assertEquals(0, registry.size());
    }

    @Test
    public void testUnsignedIdsAreDistinctKeys() {
        ConnectionRegistry registry = new ConnectionRegistry();
        long high = Long.parseUnsignedLong("18446744073709551615");
        registry.register(high, connection(high));

        assertNotNull(registry.lookup(-1L));
        assertNull(registry.lookup(Long.MAX_VALUE));
    }
}
