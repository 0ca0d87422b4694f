package com.nethernet.webrtc;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public class FakePeerTransportFactory implements PeerTransportFactory {

    public final List<FakePeerTransport> created = new ArrayList<>();

    /** Applied to each transport before it is handed out. */
    public Consumer<FakePeerTransport> onCreate = transport -> {};

    @Override
    public PeerTransport create(TransportConfig config) {
        FakePeerTransport transport = new FakePeerTransport(config);
        onCreate.accept(transport);
        created.add(transport);
        return transport;
    }

    public FakePeerTransport last() {
        return created.get(created.size() - 1);
    }
}
