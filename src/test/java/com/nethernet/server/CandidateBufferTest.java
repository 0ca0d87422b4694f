package com.nethernet.server;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateBufferTest {

    @Test
    public void testBufferCandidate_CreatesBucketLazily() {
        CandidateBuffer buffer = new CandidateBuffer();
        assertFalse(buffer.isPending(7));

        assertTrue(buffer.bufferCandidate(7, "candidate:1"));
        assertTrue(buffer.bufferCandidate(7, "candidate:2"));

        assertTrue(buffer.isPending(7));
        assertEquals(List.of("candidate:1", "candidate:2"), buffer.drainAndRemove(7));
        assertFalse(buffer.isPending(7));
    }

    @Test
    public void testDrainAndRemove_UnknownIdIsEmpty() {
        CandidateBuffer buffer = new CandidateBuffer();

        assertTrue(buffer.drainAndRemove(99).isEmpty());
        assertEquals(0, buffer.size());
    }

    @Test
    public void testOpen_KeepsExistingCandidates() {
        CandidateBuffer buffer = new CandidateBuffer();
        buffer.bufferCandidate(3, "candidate:early");

        buffer.open(3);
        buffer.open(4);

        assertEquals(List.of("candidate:early"), buffer.drainAndRemove(3));
        assertTrue(buffer.isPending(4));
        assertTrue(buffer.drainAndRemove(4).isEmpty());
    }

    @Test
    public void testLimits_PerBucketOverflowDropped() {
        CandidateBuffer buffer = new CandidateBuffer(4, 2);

        assertTrue(buffer.bufferCandidate(1, "a"));
        assertTrue(buffer.bufferCandidate(1, "b"));
        assertFalse(buffer.bufferCandidate(1, "c"));

        assertEquals(List.of("a", "b"), buffer.drainAndRemove(1));
    }

    @Test
    public void testLimits_OldestEarlyBucketEvicted() {
        CandidateBuffer buffer = new CandidateBuffer(2, 8);
        buffer.bufferCandidate(1, "a");
        buffer.bufferCandidate(2, "b");

        assertTrue(buffer.bufferCandidate(3, "c"));

        assertFalse(buffer.isPending(1));
        assertTrue(buffer.isPending(2));
        assertEquals(List.of("c"), buffer.drainAndRemove(3));
    }

    @Test
    public void testLimits_OfferBucketsNeverEvicted() {
        CandidateBuffer buffer = new CandidateBuffer(1, 8);
        buffer.bufferCandidate(1, "early");
        buffer.open(1);

        buffer.bufferCandidate(2, "b");
        buffer.bufferCandidate(3, "c");

        assertTrue(buffer.isPending(1));
        assertFalse(buffer.isPending(2));
        assertEquals(List.of("early"), buffer.drainAndRemove(1));
        assertEquals(List.of("c"), buffer.drainAndRemove(3));
    }

    @Test
    public void testRemoveAndClear() {
        CandidateBuffer buffer = new CandidateBuffer();
        buffer.bufferCandidate(1, "a");
        buffer.bufferCandidate(2, "b");

        assertTrue(buffer.remove(1));
        assertFalse(buffer.remove(1));
        buffer.clear();

        assertEquals(0, buffer.size());
    }
}
