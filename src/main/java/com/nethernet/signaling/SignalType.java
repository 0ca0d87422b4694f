package com.nethernet.signaling;

/**
 * Type tag of a NetherNet signal, as it appears at the start of the text form.
 */
public enum SignalType {
    CONNECT_REQUEST("CONNECTREQUEST"),   // SDP offer from a remote peer
    CONNECT_RESPONSE("CONNECTRESPONSE"), // SDP answer from this host
    CANDIDATE_ADD("CANDIDATEADD"),       // one ICE candidate line
    CONNECT_ERROR("CONNECTERROR"),
    UNKNOWN("UNKNOWN");

    private final String tag;

    SignalType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * @return the matching type, or {@link #UNKNOWN} for any tag this host does not know
     */
    public static SignalType fromTag(String tag) {
        for (SignalType type : values()) {
            if (type != UNKNOWN && type.tag.equals(tag)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
