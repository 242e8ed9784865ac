// file: core/src/main/java/io/cardfed/core/CanonicalProfile.java
package io.cardfed.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized profile handed to callers.
 * <p>
 * Fields:
 *  - name, game, version, refId, extId: always present.
 *  - extras: game-specific optional fields (e.g. "area", "qpro", "config").
 * <p>
 * Invariants:
 *  - Immutable; extras are deep-copied and unmodifiable.
 *  - Two profiles built from the same input are equal but never share state.
 */
public final class CanonicalProfile {

    public static final String NAME = "name";
    public static final String GAME = "game";
    public static final String VERSION = "version";
    public static final String REF_ID = "refid";
    public static final String EXT_ID = "extid";

    private final String name;
    private final Game game;
    private final int version;
    private final String refId;
    private final int extId;
    private final Map<String, Object> extras;

    public CanonicalProfile(String name, Game game, int version, String refId, int extId, Map<String, ?> extras) {
        this.name = name == null ? "" : name;
        this.game = Objects.requireNonNull(game, "game");
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
        this.version = version;
        this.refId = Objects.requireNonNull(refId, "refId");
        this.extId = extId;
        this.extras = RawProfile.deepFreeze(extras == null ? Map.of() : extras);
    }

    public String name() { return name; }

    public Game game() { return game; }

    public int version() { return version; }

    public String refId() { return refId; }

    public int extId() { return extId; }

    public Map<String, Object> extras() { return extras; }

    public Object extra(String key) { return extras.get(key); }

    /**
     * Flat wire view: the fixed fields followed by the extras.
     * Returns a fresh mutable map on every call.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(NAME, name);
        out.put(GAME, game.tag());
        out.put(VERSION, version);
        out.put(REF_ID, refId);
        out.put(EXT_ID, extId);
        out.putAll(RawProfile.deepThaw(extras));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalProfile p)) return false;
        return version == p.version
                && extId == p.extId
                && name.equals(p.name)
                && game == p.game
                && refId.equals(p.refId)
                && extras.equals(p.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, game, version, refId, extId, extras);
    }

    @Override
    public String toString() {
        return "CanonicalProfile" + toMap();
    }
}
