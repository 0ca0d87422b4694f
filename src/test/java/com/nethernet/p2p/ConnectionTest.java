package com.nethernet.p2p;

import com.nethernet.webrtc.FakeDataChannel;
import com.nethernet.webrtc.FakePeerTransport;
import com.nethernet.webrtc.TransportConfig;
import com.nethernet.webrtc.TransportException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Segmenting and reassembly of packets on the reliable channel.
 */
public class ConnectionTest {

    private FakePeerTransport transport;
    private Connection connection;
    private final List<byte[]> delivered = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        transport = new FakePeerTransport(new TransportConfig(List.of()));
        connection = new Connection(77L, transport, Runnable::run, (packet, id) -> {
            assertEquals(77L, id);
            delivered.add(packet);
        });
    }

    private static byte[] pattern(int length) {
        byte[] data = new byte[length];
        for (int i = 0; i < length; i++) {
            data[i] = (byte) (i % 251);
        }
        return data;
    }

    @Test
    public void testSend_SmallPacketIsOneSegment() throws Exception {
        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, true);
        connection.setChannels(reliable, null);

        int written = connection.send(new byte[] {1, 2, 3});

        assertEquals(3, written);
        assertEquals(1, reliable.sent.size());
        assertArrayEquals(new byte[] {0, 1, 2, 3}, reliable.sent.get(0));
    }

    @Test
    public void testSend_LargePacketIsSegmented() throws Exception {
        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, true);
        connection.setChannels(reliable, null);
        byte[] data = pattern(25_000);

        int written = connection.send(data);

        assertEquals(25_000, written);
        assertEquals(3, reliable.sent.size());
        assertEquals(2, reliable.sent.get(0)[0]);
        assertEquals(1, reliable.sent.get(1)[0]);
        assertEquals(0, reliable.sent.get(2)[0]);
        assertEquals(Connection.MAX_MESSAGE_SIZE + 1, reliable.sent.get(0).length);
        assertEquals(Connection.MAX_MESSAGE_SIZE + 1, reliable.sent.get(1).length);
        assertEquals(5_001, reliable.sent.get(2).length);
        assertEquals(data[10_000], reliable.sent.get(1)[1]);
    }

    @Test
    public void testSend_BeforeOpenIsQueuedAndFlushedOnOpen() throws Exception {
        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, false);
        connection.setChannels(reliable, null);

        assertEquals(0, connection.send(new byte[] {9, 9}));
        assertTrue(reliable.sent.isEmpty());

        reliable.open();

        assertEquals(1, reliable.sent.size());
        assertArrayEquals(new byte[] {0, 9, 9}, reliable.sent.get(0));
    }

    @Test
    public void testSend_WithoutReliableChannelIsQueued() throws Exception {
        assertEquals(0, connection.send(new byte[] {5}));

        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, true);
        connection.setChannels(reliable, null);

        assertEquals(1, reliable.sent.size());
    }

    @Test
    public void testSend_OversizedPacketRejected() {
        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, true);
        connection.setChannels(reliable, null);

        assertThrows(IllegalArgumentException.class,
            () -> connection.send(new byte[Connection.MAX_MESSAGE_SIZE * 256 + 1]));
    }

    @Test
    public void testSend_EmptyPacketRejected() {
        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, true);
        connection.setChannels(reliable, null);

        assertThrows(IllegalArgumentException.class, () -> connection.send(new byte[0]));
        assertTrue(reliable.sent.isEmpty());
    }

    @Test
    public void testSend_AfterCloseFails() {
        connection.markClosed();

        assertThrows(TransportException.class, () -> connection.send(new byte[] {1}));
    }

    @Test
    public void testReceive_SegmentsReassembled() {
        connection.handleMessage(ByteBuffer.wrap(new byte[] {1, 'a', 'b'}));
        assertTrue(delivered.isEmpty());

        connection.handleMessage(ByteBuffer.wrap(new byte[] {0, 'c'}));

        assertEquals(1, delivered.size());
        assertArrayEquals(new byte[] {'a', 'b', 'c'}, delivered.get(0));
    }

    @Test
    public void testReceive_WrongSegmentCountDiscardsPartial() {
        connection.handleMessage(ByteBuffer.wrap(new byte[] {2, 'x'}));
        // expected 1, got 0: the partial packet is dropped and this segment starts over
        connection.handleMessage(ByteBuffer.wrap(new byte[] {0, 'y'}));

        assertEquals(1, delivered.size());
        assertArrayEquals(new byte[] {'y'}, delivered.get(0));
    }

    @Test
    public void testReceive_TooShortMessageDropped() {
        connection.handleMessage(ByteBuffer.wrap(new byte[] {0}));

        assertTrue(delivered.isEmpty());
    }

    @Test
    public void testRoundTrip_LargePacketThroughChannel() throws Exception {
        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, true);
        connection.setChannels(reliable, null);
        byte[] data = pattern(21_234);

        connection.send(data);
        for (byte[] segment : reliable.sent) {
            reliable.receive(segment);
        }

        assertEquals(1, delivered.size());
        assertTrue(Arrays.equals(data, delivered.get(0)));
    }

    @Test
    public void testStateTransitions_AreOneShot() {
        assertEquals(NegotiationState.NEGOTIATING, connection.getState());
        assertTrue(connection.markEstablished());
        assertFalse(connection.markEstablished());
        assertTrue(connection.markClosed());
        assertFalse(connection.markClosed());
        assertFalse(connection.markEstablished());
        assertEquals(NegotiationState.CLOSED, connection.getState());
    }

    @Test
    public void testClose_ReleasesChannelsAndTransport() {
        FakeDataChannel reliable = new FakeDataChannel(Connection.RELIABLE_LABEL, true);
        FakeDataChannel unreliable = new FakeDataChannel(Connection.UNRELIABLE_LABEL, true);
        connection.setChannels(reliable, unreliable);

        connection.close();

        assertTrue(reliable.closed);
        assertTrue(unreliable.closed);
        assertTrue(transport.closed);
    }
}
