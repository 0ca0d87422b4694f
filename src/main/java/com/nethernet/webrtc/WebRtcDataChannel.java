package com.nethernet.webrtc;

import dev.onvoid.webrtc.RTCDataChannel;
import dev.onvoid.webrtc.RTCDataChannelBuffer;
import dev.onvoid.webrtc.RTCDataChannelObserver;
import dev.onvoid.webrtc.RTCDataChannelState;

import java.nio.ByteBuffer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DataChannel} over a webrtc-java {@link RTCDataChannel}.
 */
class WebRtcDataChannel implements DataChannel {

    private static final Logger LOGGER = Logger.getLogger(WebRtcDataChannel.class.getName());

    private final RTCDataChannel channel;
    private final String label;

    WebRtcDataChannel(RTCDataChannel channel) {
        this.channel = channel;
        this.label = channel.getLabel();
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public boolean isOpen() {
        return channel.getState() == RTCDataChannelState.OPEN;
    }

    @Override
    public void send(ByteBuffer message) throws TransportException {
        if (!isOpen()) {
            throw new TransportException("DataChannel " + label + " not open");
        }
        // native side wants a direct buffer
        ByteBuffer direct = ByteBuffer.allocateDirect(message.remaining());
        direct.put(message.duplicate());
        direct.flip();
        try {
            channel.send(new RTCDataChannelBuffer(direct, true));
        } catch (Exception e) {
            throw new TransportException("DataChannel send failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void setObserver(DataChannelObserver observer) {
        channel.registerObserver(new RTCDataChannelObserver() {
            @Override
            public void onBufferedAmountChange(long previousAmount) {}

            @Override
            public void onStateChange() {
                RTCDataChannelState state = channel.getState();
                if (state == RTCDataChannelState.OPEN) {
                    observer.onOpen();
                } else if (state == RTCDataChannelState.CLOSED) {
                    observer.onClose();
                }
            }

            @Override
            public void onMessage(RTCDataChannelBuffer buffer) {
                ByteBuffer src = buffer.data.duplicate();
                ByteBuffer copy = ByteBuffer.allocate(src.remaining());
                copy.put(src);
                copy.flip();
                observer.onMessage(copy);
            }
        });
    }

    @Override
    public void close() {
        try {
            channel.unregisterObserver();
            channel.close();
            channel.dispose();
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "[WebRTC] Error closing data channel " + label, e);
        }
    }
}
