package com.nethernet.webrtc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IceStateTest {

    @Test
    public void testClassification() {
        assertTrue(IceState.CONNECTED.isConnected());
        assertTrue(IceState.COMPLETED.isConnected());
        assertFalse(IceState.CHECKING.isConnected());

        assertTrue(IceState.DISCONNECTED.isTerminal());
        assertTrue(IceState.FAILED.isTerminal());
        assertTrue(IceState.CLOSED.isTerminal());
        assertFalse(IceState.NEW.isTerminal());
        assertFalse(IceState.CONNECTED.isTerminal());
    }

    @Test
    public void testReason() {
        assertEquals("failed", IceState.FAILED.reason());
        assertEquals("disconnected", IceState.DISCONNECTED.reason());
    }
}
