package com.nethernet.server;

import com.nethernet.p2p.Connection;
import com.nethernet.p2p.NegotiationState;
import com.nethernet.signaling.IceServer;
import com.nethernet.signaling.SignalStructure;
import com.nethernet.signaling.SignalType;
import com.nethernet.signaling.SignalingChannel;
import com.nethernet.signaling.SignalingException;
import com.nethernet.webrtc.DataChannel;
import com.nethernet.webrtc.IceState;
import com.nethernet.webrtc.PeerTransport;
import com.nethernet.webrtc.PeerTransportFactory;
import com.nethernet.webrtc.PeerTransportListener;
import com.nethernet.webrtc.SessionDescription;
import com.nethernet.webrtc.TransportConfig;
import com.nethernet.webrtc.TransportException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NetherNet host: answers offers that remote peers send over the signaling channel and exposes the
 * resulting data-channel connections to the application.
 *
 * Connection lifecycle per connection id:
 * 1. A CANDIDATEADD before any offer opens a pending bucket (PENDING)
 * 2. CONNECTREQUEST creates the transport and registers the connection (NEGOTIATING)
 * 3. The answer is sent as CONNECTRESPONSE, then buffered candidates are applied in order
 * 4. ICE connected fires onOpenConnection once (ESTABLISHED)
 * 5. ICE disconnected/failed/closed fires onCloseConnection once and forgets the id (CLOSED)
 *
 * <p>Signal dispatch, transport callbacks and all registry and buffer mutations run one at a time
 * on a single event executor. {@link #handleOffer} and {@link #handleCandidate} must be called on
 * it; {@link #listen()} routes signals there.
 */
public class NetherNetServer {

    private static final Logger LOGGER = Logger.getLogger(NetherNetServer.class.getName());

    static final String CANDIDATE_MID = "0";

    private final long networkId;
    private final long connectionId;
    private final SignalingChannel signaling;
    private final PeerTransportFactory transportFactory;
    private final HostConfig config;

    private final Executor events;
    private final ExecutorService ownedEvents;
    // thread currently running a host task, for re-entrant close()
    private volatile Thread eventThread;
    private volatile boolean closed = false;

    private final ConnectionRegistry connections = new ConnectionRegistry();
    private final CandidateBuffer pendingCandidates;
    private final Map<Long, Boolean> recentlyClosed;
    private final SignalDispatcher dispatcher = new SignalDispatcher();

    private volatile Consumer<Connection> onOpenConnectionCallback = connection -> {};
    private volatile BiConsumer<Long, String> onCloseConnectionCallback = (id, reason) -> {};
    private volatile BiConsumer<byte[], Long> onEncapsulatedCallback = (packet, id) -> {};

    public NetherNetServer(SignalingChannel signaling, PeerTransportFactory transportFactory, HostConfig config) {
        this(signaling, transportFactory, config, randomId(), randomId());
    }

    public NetherNetServer(SignalingChannel signaling, PeerTransportFactory transportFactory, HostConfig config,
                           long networkId, long connectionId) {
        this(signaling, transportFactory, config, null, networkId, connectionId);
    }

    /**
     * @param events executor all host state is confined to; {@code null} for an owned single thread
     */
    public NetherNetServer(SignalingChannel signaling, PeerTransportFactory transportFactory, HostConfig config,
                           Executor events, long networkId, long connectionId) {
        this.signaling = signaling;
        this.transportFactory = transportFactory;
        this.config = config;
        this.networkId = networkId;
        this.connectionId = connectionId;
        this.pendingCandidates = new CandidateBuffer(
            config.getMaxPendingConnections(), config.getMaxCandidatesPerConnection());

        if (events == null) {
            this.ownedEvents = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "NetherNetHost-" + Long.toUnsignedString(networkId));
                t.setDaemon(true);
                return t;
            });
            this.events = ownedEvents;
        } else {
            this.ownedEvents = null;
            this.events = events;
        }

        int closedLimit = config.getMaxPendingConnections();
        this.recentlyClosed = new LinkedHashMap<Long, Boolean>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
                return size() > closedLimit;
            }
        };

        dispatcher.addSignalHandler(SignalType.CONNECT_REQUEST, this::handleOffer);
        dispatcher.addSignalHandler(SignalType.CANDIDATE_ADD, this::handleCandidate);
    }

    /**
     * Uniformly distributed 64-bit identifier. Collisions are not checked.
     */
    public static long randomId() {
        return ThreadLocalRandom.current().nextLong();
    }

    // ===============================
    // Lifecycle
    // ===============================

    /**
     * Subscribes to the signaling channel, then connects it.
     */
    public void listen() throws SignalingException {
        // subscribe first, the relay may forward signals right behind the credentials
        signaling.setOnSignalCallback(signal -> post(() -> dispatcher.dispatch(signal)));
        try {
            signaling.connect();
        } catch (SignalingException e) {
            signaling.setOnSignalCallback(null);
            throw e;
        }
        LOGGER.info(String.format("[Host] Listening as network %s", Long.toUnsignedString(networkId)));
    }

    /**
     * Closes every registered connection and forgets all connection and candidate state. Signals and
     * transport events arriving afterwards are dropped. Safe to call more than once, also from a
     * host callback. The signaling channel is left to its owner.
     */
    public void close() {
        closed = true;
        runOnEvents(() -> {
            List<Connection> snapshot = connections.values();
            for (Connection connection : snapshot) {
                connection.markClosed();
                try {
                    connection.close();
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "[Host] Error closing " + connection, e);
                }
            }
            connections.clear();
            pendingCandidates.clear();
            recentlyClosed.clear();
            if (!snapshot.isEmpty()) {
                LOGGER.info(String.format("[Host] Closed %d connections", snapshot.size()));
            }
        });
        if (ownedEvents != null) {
            ownedEvents.shutdown();
            if (Thread.currentThread() != eventThread) {
                try {
                    ownedEvents.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // ===============================
    // Signal handling
    // ===============================

    /**
     * Answers a CONNECTREQUEST.
     *
     * @throws ConfigurationException if the signaling channel has no credentials yet; nothing is
     *                                created and nothing is sent
     * @throws NegotiationException   if the offer is rejected or no usable answer is produced; the
     *                                connection has been closed by the time this is thrown
     */
    public void handleOffer(SignalStructure signal) throws ConfigurationException, NegotiationException {
        long id = signal.getConnectionId();
        String idString = Long.toUnsignedString(id);
        if (closed) {
            LOGGER.fine("[Host] Host closed, ignoring offer for " + idString);
            return;
        }

        List<IceServer> credentials = signaling.getCredentials();
        if (credentials == null) {
            throw new ConfigurationException("No credentials set");
        }

        PeerTransport transport;
        try {
            transport = transportFactory.create(new TransportConfig(credentials));
        } catch (TransportException e) {
            throw new NegotiationException(id, "Failed to create transport for connection " + idString, e);
        }

        Connection connection = new Connection(id, transport, events, this::deliverEncapsulated);
        Connection previous = connections.register(id, connection);
        recentlyClosed.remove(id);
        pendingCandidates.open(id);

        if (previous != null) {
            LOGGER.warning(String.format("[Host] New offer for live connection %s, replacing it", idString));
            handleTerminalState(previous, IceState.CLOSED);
        }

        transport.setListener(new ConnectionListener(connection, signal.getNetworkId()));

        try {
            transport.setRemoteDescription(signal.getData(), SessionDescription.Kind.OFFER);
        } catch (TransportException e) {
            throw failNegotiation(connection, "Remote offer rejected: " + e.getMessage(), e);
        }

        SessionDescription answer = transport.localDescription();
        if (answer == null || !answer.isUsableAnswer()) {
            throw failNegotiation(connection, "Failed to generate answer", null);
        }

        try {
            signaling.write(new SignalStructure(
                SignalType.CONNECT_RESPONSE, id, answer.getSdp(), signal.getNetworkId()));
        } catch (SignalingException e) {
            throw failNegotiation(connection, "Failed to send answer: " + e.getMessage(), e);
        }

        List<String> buffered = pendingCandidates.drainAndRemove(id);
        for (String candidate : buffered) {
            try {
                transport.addRemoteCandidate(candidate, CANDIDATE_MID);
            } catch (TransportException e) {
                LOGGER.warning(String.format("[Host] Failed to add queued candidate for %s: %s",
                    idString, e.getMessage()));
            }
        }

        LOGGER.info(String.format("[Host] Answered offer for connection %s (%d queued candidates)",
            idString, buffered.size()));
    }

    /**
     * Handles a CANDIDATEADD. Never throws: transport failures are logged and the candidate dropped.
     */
    public void handleCandidate(SignalStructure signal) {
        long id = signal.getConnectionId();
        String candidate = signal.getData();
        if (closed) {
            return;
        }

        if (pendingCandidates.isPending(id)) {
            if (!pendingCandidates.bufferCandidate(id, candidate)) {
                LOGGER.warning("[Host] Pending candidate limit reached for " + Long.toUnsignedString(id));
            }
            return;
        }

        Connection connection = connections.lookup(id);
        if (connection != null) {
            try {
                connection.getTransport().addRemoteCandidate(candidate, CANDIDATE_MID);
            } catch (TransportException e) {
                LOGGER.warning(String.format("[Host] Failed to add remote candidate for %s (likely closed): %s",
                    Long.toUnsignedString(id), e.getMessage()));
            }
            return;
        }

        if (recentlyClosed.containsKey(id)) {
            LOGGER.fine("[Host] Dropping candidate for closed connection " + Long.toUnsignedString(id));
            return;
        }

        if (config.isBufferEarlyCandidates()) {
            if (pendingCandidates.bufferCandidate(id, candidate)) {
                LOGGER.fine("[Host] Buffered candidate ahead of offer for " + Long.toUnsignedString(id));
            } else {
                LOGGER.warning("[Host] Pending candidate limit reached for " + Long.toUnsignedString(id));
            }
            return;
        }

        LOGGER.warning("[Host] Received candidate for unknown connection " + Long.toUnsignedString(id));
    }

    // ===============================
    // Transport events
    // ===============================

    private void handleStateChange(Connection connection, IceState state) {
        if (state.isConnected()) {
            if (connection.markEstablished()) {
                LOGGER.info("[Host] Connection established: " + Long.toUnsignedString(connection.getConnectionId()));
                try {
                    onOpenConnectionCallback.accept(connection);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "[Host] onOpenConnection handler failed", e);
                }
            }
        } else if (state.isTerminal()) {
            handleTerminalState(connection, state);
        }
    }

    /**
     * Notifies the application, releases the connection and forgets its id. Runs at most once per
     * connection. A connection that was replaced by a newer offer leaves its successor registered.
     */
    private void handleTerminalState(Connection connection, IceState state) {
        if (!connection.markClosed()) {
            return;
        }
        long id = connection.getConnectionId();
        LOGGER.info(String.format("[Host] Connection %s closed: %s", Long.toUnsignedString(id), state.reason()));

        try {
            onCloseConnectionCallback.accept(id, state.reason());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[Host] onCloseConnection handler failed", e);
        }
        connection.close();
        if (connections.unregister(id, connection)) {
            pendingCandidates.remove(id);
            recentlyClosed.put(id, Boolean.TRUE);
        }
    }

    private NegotiationException failNegotiation(Connection connection, String message, Throwable cause) {
        LOGGER.severe(String.format("[Host] Negotiation failed for %s: %s",
            Long.toUnsignedString(connection.getConnectionId()), message));
        handleTerminalState(connection, IceState.FAILED);
        return new NegotiationException(connection.getConnectionId(), message, cause);
    }

    private void bindDataChannel(Connection connection, DataChannel channel) {
        if (connection.getState() == NegotiationState.CLOSED) {
            channel.close();
            return;
        }
        String label = channel.getLabel();
        if (Connection.RELIABLE_LABEL.equals(label)) {
            connection.setChannels(channel, null);
        } else if (Connection.UNRELIABLE_LABEL.equals(label)) {
            connection.setChannels(null, channel);
        } else {
            LOGGER.fine(String.format("[Host] Ignoring data channel '%s' on %s",
                label, Long.toUnsignedString(connection.getConnectionId())));
        }
    }

    private void sendLocalCandidate(Connection connection, String candidate, long remoteNetworkId) {
        if (connection.getState() == NegotiationState.CLOSED) {
            return;
        }
        try {
            signaling.write(new SignalStructure(
                SignalType.CANDIDATE_ADD, connection.getConnectionId(), candidate, remoteNetworkId));
        } catch (SignalingException e) {
            LOGGER.warning(String.format("[Host] Failed to send local candidate for %s: %s",
                Long.toUnsignedString(connection.getConnectionId()), e.getMessage()));
        }
    }

    private void deliverEncapsulated(byte[] packet, Long id) {
        onEncapsulatedCallback.accept(packet, id);
    }

    /**
     * Transport events for one connection, handed to the event executor in arrival order.
     */
    private final class ConnectionListener implements PeerTransportListener {
        private final Connection connection;
        private final long remoteNetworkId;

        ConnectionListener(Connection connection, long remoteNetworkId) {
            this.connection = connection;
            this.remoteNetworkId = remoteNetworkId;
        }

        @Override
        public void onLocalCandidate(String candidate) {
            post(() -> sendLocalCandidate(connection, candidate, remoteNetworkId));
        }

        @Override
        public void onDataChannel(DataChannel channel) {
            post(() -> bindDataChannel(connection, channel));
        }

        @Override
        public void onStateChange(IceState state) {
            post(() -> handleStateChange(connection, state));
        }
    }

    // ===============================
    // Event executor
    // ===============================

    private void post(Runnable task) {
        if (closed) {
            LOGGER.fine("[Host] Event dropped, host is closed");
            return;
        }
        try {
            events.execute(() -> runAsEvent(task));
        } catch (RejectedExecutionException e) {
            LOGGER.fine("[Host] Event dropped, host is closed");
        }
    }

    private void runAsEvent(Runnable task) {
        Thread previous = eventThread;
        eventThread = Thread.currentThread();
        try {
            task.run();
        } finally {
            eventThread = previous;
        }
    }

    private void runOnEvents(Runnable task) {
        if (Thread.currentThread() == eventThread) {
            task.run();
            return;
        }
        try {
            CompletableFuture.runAsync(() -> runAsEvent(task), events).join();
        } catch (RejectedExecutionException e) {
            task.run();
        }
    }

    // ===============================
    // Callbacks and accessors
    // ===============================

    public void setOnOpenConnection(Consumer<Connection> callback) {
        this.onOpenConnectionCallback = callback;
    }

    public void setOnCloseConnection(BiConsumer<Long, String> callback) {
        this.onCloseConnectionCallback = callback;
    }

    public void setOnEncapsulated(BiConsumer<byte[], Long> callback) {
        this.onEncapsulatedCallback = callback;
    }

    public long getNetworkId() {
        return networkId;
    }

    public long getConnectionId() {
        return connectionId;
    }

    SignalDispatcher dispatcher() {
        return dispatcher;
    }

    ConnectionRegistry registry() {
        return connections;
    }

    CandidateBuffer candidateBuffer() {
        return pendingCandidates;
    }
}
