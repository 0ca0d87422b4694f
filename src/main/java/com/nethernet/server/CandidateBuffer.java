package com.nethernet.server;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Remote ICE candidates held back until their connection's answer has been sent.
 *
 * <p>Buckets come in two kinds. {@link #open} creates one for an offer being answered; it is never
 * evicted. {@link #bufferCandidate} creates one for a candidate that arrived ahead of its offer;
 * these are kept in arrival order and the oldest is evicted once the limit is reached.
 *
 * <p>Not thread-safe; confined to the host's event executor.
 */
public class CandidateBuffer {

    private static final Logger LOGGER = Logger.getLogger(CandidateBuffer.class.getName());

    private final Map<Long, List<String>> offerBuckets = new HashMap<>();
    private final LinkedHashMap<Long, List<String>> earlyBuckets = new LinkedHashMap<>();
    private final int maxPendingConnections;
    private final int maxPerConnection;

    public CandidateBuffer() {
        this(Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    /**
     * @param maxPendingConnections early buckets kept before the oldest is evicted
     * @param maxPerConnection      candidates kept per bucket
     */
    public CandidateBuffer(int maxPendingConnections, int maxPerConnection) {
        this.maxPendingConnections = maxPendingConnections;
        this.maxPerConnection = maxPerConnection;
    }

    /**
     * Opens a bucket for an offer being answered, adopting any early candidates for the id.
     */
    public void open(long connectionId) {
        if (offerBuckets.containsKey(connectionId)) {
            return;
        }
        List<String> early = earlyBuckets.remove(connectionId);
        offerBuckets.put(connectionId, early == null ? new ArrayList<>() : early);
    }

    public boolean isPending(long connectionId) {
        return offerBuckets.containsKey(connectionId) || earlyBuckets.containsKey(connectionId);
    }

    /**
     * Appends to the bucket, creating an early bucket if absent.
     *
     * @return false if the bucket is full and the candidate was dropped
     */
    public boolean bufferCandidate(long connectionId, String payload) {
        List<String> pending = offerBuckets.get(connectionId);
        if (pending == null) {
            pending = earlyBuckets.get(connectionId);
        }
        if (pending == null) {
            evictOldestEarly();
            pending = new ArrayList<>();
            earlyBuckets.put(connectionId, pending);
        }
        if (pending.size() >= maxPerConnection) {
            return false;
        }
        pending.add(payload);
        return true;
    }

    private void evictOldestEarly() {
        Iterator<Map.Entry<Long, List<String>>> it = earlyBuckets.entrySet().iterator();
        while (earlyBuckets.size() >= maxPendingConnections && it.hasNext()) {
            Map.Entry<Long, List<String>> eldest = it.next();
            it.remove();
            LOGGER.fine(String.format("[Host] Evicted %d early candidates for %s",
                eldest.getValue().size(), Long.toUnsignedString(eldest.getKey())));
        }
    }

    /**
     * @return the buffered candidates in arrival order, empty if there was no bucket
     */
    public List<String> drainAndRemove(long connectionId) {
        List<String> pending = offerBuckets.remove(connectionId);
        if (pending == null) {
            pending = earlyBuckets.remove(connectionId);
        }
        return pending == null ? List.of() : pending;
    }

    public boolean remove(long connectionId) {
        boolean removed = offerBuckets.remove(connectionId) != null;
        return earlyBuckets.remove(connectionId) != null || removed;
    }

    public int size() {
        return offerBuckets.size() + earlyBuckets.size();
    }

    public void clear() {
        offerBuckets.clear();
        earlyBuckets.clear();
    }
}
