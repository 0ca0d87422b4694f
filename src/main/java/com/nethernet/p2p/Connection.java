package com.nethernet.p2p;

import com.nethernet.webrtc.DataChannel;
import com.nethernet.webrtc.DataChannelObserver;
import com.nethernet.webrtc.PeerTransport;
import com.nethernet.webrtc.TransportException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One NetherNet connection: a peer transport plus the reliable and unreliable data channels the
 * remote peer opens on it.
 *
 * <p>Game packets travel on the reliable channel split into segments of at most
 * {@link #MAX_MESSAGE_SIZE} bytes. Each segment starts with one byte holding how many segments
 * still follow it, so the last one carries 0.
 *
 * <p>Channel events are handed to the host's event executor; reassembly state is only touched
 * there.
 */
public class Connection {

    private static final Logger LOGGER = Logger.getLogger(Connection.class.getName());

    public static final String RELIABLE_LABEL = "ReliableDataChannel";
    public static final String UNRELIABLE_LABEL = "UnreliableDataChannel";

    public static final int MAX_MESSAGE_SIZE = 10_000;
    private static final int MAX_SEGMENTS = 256;

    private final long connectionId;
    private final PeerTransport transport;
    private final Executor events;
    private final BiConsumer<byte[], Long> onEncapsulated;

    private DataChannel reliable;
    private DataChannel unreliable;
    private volatile NegotiationState state = NegotiationState.NEGOTIATING;

    // inbound reassembly
    private int promisedSegments = 0;
    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

    // outbound packets written before the reliable channel opened
    private final List<byte[]> sendQueue = new ArrayList<>();

    public Connection(long connectionId, PeerTransport transport, Executor events,
                      BiConsumer<byte[], Long> onEncapsulated) {
        this.connectionId = connectionId;
        this.transport = transport;
        this.events = events;
        this.onEncapsulated = onEncapsulated;
    }

    public long getConnectionId() {
        return connectionId;
    }

    public PeerTransport getTransport() {
        return transport;
    }

    public NegotiationState getState() {
        return state;
    }

    public synchronized DataChannel getReliable() {
        return reliable;
    }

    public synchronized DataChannel getUnreliable() {
        return unreliable;
    }

    /**
     * NEGOTIATING to ESTABLISHED.
     *
     * @return false if the connection was already established or closed
     */
    public synchronized boolean markEstablished() {
        if (state != NegotiationState.NEGOTIATING) {
            return false;
        }
        state = NegotiationState.ESTABLISHED;
        return true;
    }

    /**
     * @return false if the connection was already closed
     */
    public synchronized boolean markClosed() {
        if (state == NegotiationState.CLOSED) {
            return false;
        }
        state = NegotiationState.CLOSED;
        return true;
    }

    /**
     * Binds whichever channels are non-null.
     */
    public synchronized void setChannels(DataChannel reliableChannel, DataChannel unreliableChannel) {
        if (reliableChannel != null) {
            this.reliable = reliableChannel;
            reliableChannel.setObserver(new DataChannelObserver() {
                @Override
                public void onOpen() {
                    post(Connection.this::flushQueue);
                }

                @Override
                public void onMessage(ByteBuffer message) {
                    post(() -> handleMessage(message));
                }

                @Override
                public void onClose() {
                    LOGGER.fine(String.format("[Connection] %s: reliable channel closed", idString()));
                }
            });
            if (reliableChannel.isOpen()) {
                post(this::flushQueue);
            }
        }
        if (unreliableChannel != null) {
            this.unreliable = unreliableChannel;
        }
    }

    /**
     * Sends one packet on the reliable channel, segmenting it as needed. Packets sent before the
     * reliable channel is open are queued. Empty packets are rejected: a segment must carry at
     * least one payload byte for the receiver to accept it.
     *
     * @return the number of payload bytes written, 0 if the packet was queued
     * @throws TransportException if the connection is closed or the channel rejects a segment
     * @throws IllegalArgumentException if the packet is empty or needs more than 256 segments
     */
    public synchronized int send(byte[] data) throws TransportException {
        if (state == NegotiationState.CLOSED) {
            throw new TransportException("Connection " + idString() + " is closed");
        }
        if (data.length == 0) {
            throw new IllegalArgumentException("Empty packet for connection " + idString());
        }
        int segments = (data.length + MAX_MESSAGE_SIZE - 1) / MAX_MESSAGE_SIZE;
        if (segments > MAX_SEGMENTS) {
            throw new IllegalArgumentException("Packet of " + data.length + " bytes needs "
                + segments + " segments, at most " + MAX_SEGMENTS + " allowed");
        }
        if (reliable == null || !reliable.isOpen()) {
            sendQueue.add(data);
            return 0;
        }
        return sendSegments(data, segments);
    }

    private int sendSegments(byte[] data, int segments) throws TransportException {
        int written = 0;
        for (int offset = 0; offset < data.length; offset += MAX_MESSAGE_SIZE) {
            segments--;
            int length = Math.min(MAX_MESSAGE_SIZE, data.length - offset);
            ByteBuffer message = ByteBuffer.allocate(length + 1);
            message.put((byte) segments);
            message.put(data, offset, length);
            message.flip();
            reliable.send(message);
            written += length;
        }
        return written;
    }

    synchronized void flushQueue() {
        if (sendQueue.isEmpty() || reliable == null || !reliable.isOpen()) {
            return;
        }
        List<byte[]> queued = new ArrayList<>(sendQueue);
        sendQueue.clear();
        LOGGER.fine(String.format("[Connection] %s: flushing %d queued packets", idString(), queued.size()));
        for (byte[] packet : queued) {
            try {
                sendSegments(packet, (packet.length + MAX_MESSAGE_SIZE - 1) / MAX_MESSAGE_SIZE);
            } catch (TransportException e) {
                LOGGER.warning(String.format("[Connection] %s: failed to flush queued packet: %s",
                    idString(), e.getMessage()));
            }
        }
    }

    /**
     * Takes one reliable-channel message. Delivers the packet once its last segment arrives.
     */
    void handleMessage(ByteBuffer message) {
        if (message.remaining() < 2) {
            LOGGER.warning(String.format("[Connection] %s: dropping %d-byte message, too short",
                idString(), message.remaining()));
            return;
        }
        int segments = message.get() & 0xFF;
        if (promisedSegments > 0 && promisedSegments - 1 != segments) {
            LOGGER.warning(String.format(
                "[Connection] %s: invalid promised segments: expected %d, got %d; discarding partial packet",
                idString(), promisedSegments - 1, segments));
            partial.reset();
        }
        promisedSegments = segments;

        byte[] chunk = new byte[message.remaining()];
        message.get(chunk);
        partial.write(chunk, 0, chunk.length);
        if (promisedSegments > 0) {
            return;
        }

        byte[] packet = partial.toByteArray();
        partial.reset();
        try {
            onEncapsulated.accept(packet, connectionId);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[Connection] " + idString() + ": packet handler failed", e);
        }
    }

    /**
     * Releases both channels and the transport. Transport failures are logged.
     */
    public synchronized void close() {
        sendQueue.clear();
        if (reliable != null) {
            reliable.close();
        }
        if (unreliable != null) {
            unreliable.close();
        }
        try {
            transport.close();
        } catch (TransportException e) {
            LOGGER.warning(String.format("[Connection] %s: error closing transport: %s", idString(), e.getMessage()));
        }
    }

    private void post(Runnable task) {
        try {
            events.execute(task);
        } catch (RuntimeException e) {
            LOGGER.fine(String.format("[Connection] %s: event dropped, host is shutting down", idString()));
        }
    }

    private String idString() {
        return Long.toUnsignedString(connectionId);
    }

    @Override
    public String toString() {
        return "Connection[" + idString() + ", " + state + "]";
    }
}
