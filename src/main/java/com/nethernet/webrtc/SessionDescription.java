package com.nethernet.webrtc;

/**
 * An SDP blob and its role in the offer/answer exchange.
 */
public final class SessionDescription {

    public enum Kind {
        OFFER,
        ANSWER
    }

    private final Kind kind;
    private final String sdp;

    public SessionDescription(Kind kind, String sdp) {
        this.kind = kind;
        this.sdp = sdp;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSdp() {
        return sdp;
    }

    public boolean isUsableAnswer() {
        return kind == Kind.ANSWER && sdp != null && !sdp.isEmpty();
    }
}
