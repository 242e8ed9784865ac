package io.cardfed.server.peer;

import java.util.Locale;

/**
 * How a peer query selects profiles.
 *  - CARD:   profiles of users owning any of the listed card ids.
 *  - SERVER: every profile the peer holds for the game/version; ids are ignored.
 */
public enum IdType {
    CARD("card"),
    SERVER("server");

    private final String wire;

    IdType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static IdType fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("idType must not be null");
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (IdType t : values()) {
            if (t.wire.equals(v)) return t;
        }
        throw new IllegalArgumentException("idType must be one of: card, server (got " + s + ")");
    }
}
