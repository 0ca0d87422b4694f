package com.nethernet.server;

import com.nethernet.p2p.Connection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connections by connection id, from offer until a terminal transport state.
 *
 * <p>Not thread-safe; confined to the host's event executor.
 */
public class ConnectionRegistry {

    private final Map<Long, Connection> connections = new HashMap<>();

    /**
     * @return the connection previously registered under the id, or {@code null}
     */
    public Connection register(long connectionId, Connection connection) {
        return connections.put(connectionId, connection);
    }

    /**
     * @return the connection, or {@code null} if none is registered
     */
    public Connection lookup(long connectionId) {
        return connections.get(connectionId);
    }

    public boolean unregister(long connectionId) {
        return connections.remove(connectionId) != null;
    }

    /**
     * Removes the entry only while it still maps to {@code expected}.
     */
    public boolean unregister(long connectionId, Connection expected) {
        return connections.remove(connectionId, expected);
    }

    /**
     * @return a snapshot of the registered connections
     */
    public List<Connection> values() {
        return new ArrayList<>(connections.values());
    }

    public int size() {
        return connections.size();
    }

    public void clear() {
        connections.clear();
    }
}
