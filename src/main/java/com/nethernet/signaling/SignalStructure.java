package com.nethernet.signaling;

import java.util.Objects;

/**
 * One signaling message. Immutable.
 *
 * Text form is {@code <TYPE> <connectionId> <data>}, the connection id written as an unsigned
 * decimal. The network id is not part of the text; it travels beside it (sender on inbound
 * signals, addressee on outbound ones).
 */
public final class SignalStructure {

    private final SignalType type;
    private final long connectionId;
    private final String data;
    private final long networkId;

    public SignalStructure(SignalType type, long connectionId, String data, long networkId) {
        this.type = Objects.requireNonNull(type, "type");
        this.connectionId = connectionId;
        this.data = data == null ? "" : data;
        this.networkId = networkId;
    }

    public SignalType getType() {
        return type;
    }

    public long getConnectionId() {
        return connectionId;
    }

    public String getData() {
        return data;
    }

    public long getNetworkId() {
        return networkId;
    }

    /**
     * Parses the text form.
     *
     * @throws IllegalArgumentException if the message has no connection id or it is not an
     *                                  unsigned 64-bit decimal
     */
    public static SignalStructure fromString(String message, long networkId) {
        if (message == null) {
            throw new IllegalArgumentException("Signal message is null");
        }
        String[] parts = message.split(" ", 3);
        if (parts.length < 2 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("Malformed signal: '" + message + "'");
        }
        long connectionId;
        try {
            connectionId = Long.parseUnsignedLong(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed connection id in signal: '" + parts[1] + "'", e);
        }
        String data = parts.length == 3 ? parts[2] : "";
        return new SignalStructure(SignalType.fromTag(parts[0]), connectionId, data, networkId);
    }

    @Override
    public String toString() {
        return type.getTag() + " " + Long.toUnsignedString(connectionId) + " " + data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalStructure)) return false;
        SignalStructure that = (SignalStructure) o;
        return connectionId == that.connectionId
            && networkId == that.networkId
            && type == that.type
            && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, connectionId, data, networkId);
    }
}
