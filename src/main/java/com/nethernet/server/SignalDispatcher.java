package com.nethernet.server;

import com.nethernet.NetherNetException;
import com.nethernet.signaling.SignalStructure;
import com.nethernet.signaling.SignalType;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes inbound signals to the handler registered for their type. Nothing thrown by a handler
 * escapes {@link #dispatch}.
 */
public class SignalDispatcher {

    private static final Logger LOGGER = Logger.getLogger(SignalDispatcher.class.getName());

    @FunctionalInterface
    public interface SignalHandler {
        void handle(SignalStructure signal) throws NetherNetException;
    }

    private final Map<SignalType, SignalHandler> handlers = new EnumMap<>(SignalType.class);

    public void addSignalHandler(SignalType type, SignalHandler handler) {
        handlers.put(type, handler);
    }

    public void dispatch(SignalStructure signal) {
        SignalHandler handler = handlers.get(signal.getType());
        if (handler == null) {
            LOGGER.warning(String.format("[Dispatcher] Received signal for unknown type %s (connection %s)",
                signal.getType(), Long.toUnsignedString(signal.getConnectionId())));
            return;
        }

        try {
            handler.handle(signal);
        } catch (ConfigurationException e) {
            LOGGER.severe(String.format("[Dispatcher] Dropped %s for connection %s: %s",
                signal.getType(), Long.toUnsignedString(signal.getConnectionId()), e.getMessage()));
        } catch (NetherNetException e) {
            LOGGER.log(Level.SEVERE, String.format("[Dispatcher] %s for connection %s failed: %s",
                signal.getType(), Long.toUnsignedString(signal.getConnectionId()), e.getMessage()), e);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "[Dispatcher] Unexpected error handling " + signal.getType(), e);
        }
    }
}
