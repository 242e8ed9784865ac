package io.cardfed.core;

/**
 * How closely a peer's profile matches the requested game/version.
 */
public enum MatchQuality {
    /** Peer asserts the profile is for exactly the requested game and version. */
    EXACT,
    /** Profile exists for the card, but not confirmed for the requested version. */
    PARTIAL;

    public static final String WIRE_EXACT = "exact";
    public static final String WIRE_PARTIAL = "partial";

    /** Anything other than the literal "exact" marker, including null, is partial. */
    public static MatchQuality fromWire(Object marker) {
        return WIRE_EXACT.equals(marker) ? EXACT : PARTIAL;
    }

    public String wire() {
        return this == EXACT ? WIRE_EXACT : WIRE_PARTIAL;
    }
}
