package com.nethernet.server;

import com.nethernet.signaling.SignalStructure;
import com.nethernet.signaling.SignalType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SignalDispatcherTest {

    @Test
    public void testDispatch_RoutesByType() {
        SignalDispatcher dispatcher = new SignalDispatcher();
        List<String> seen = new ArrayList<>();
        dispatcher.addSignalHandler(SignalType.CONNECT_REQUEST, s -> seen.add("offer:" + s.getConnectionId()));
        dispatcher.addSignalHandler(SignalType.CANDIDATE_ADD, s -> seen.add("candidate:" + s.getConnectionId()));

        dispatcher.dispatch(new SignalStructure(SignalType.CANDIDATE_ADD, 1, "c", 0));
        dispatcher.dispatch(new SignalStructure(SignalType.CONNECT_REQUEST, 2, "o", 0));
        dispatcher.dispatch(new SignalStructure(SignalType.CONNECT_RESPONSE, 3, "a", 0));
        dispatcher.dispatch(new SignalStructure(SignalType.UNKNOWN, 4, "?", 0));

        assertEquals(List.of("candidate:1", "offer:2"), seen);
    }

    @Test
    public void testDispatch_HandlerFailuresDoNotEscape() {
        SignalDispatcher dispatcher = new SignalDispatcher();
        dispatcher.addSignalHandler(SignalType.CONNECT_REQUEST, s -> {
            throw new ConfigurationException("No credentials set");
        });
        dispatcher.addSignalHandler(SignalType.CANDIDATE_ADD, s -> {
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> dispatcher.dispatch(new SignalStructure(SignalType.CONNECT_REQUEST, 1, "o", 0)));
        assertDoesNotThrow(() -> dispatcher.dispatch(new SignalStructure(SignalType.CANDIDATE_ADD, 1, "c", 0)));
    }
}
