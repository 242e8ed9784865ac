// file: core/src/main/java/io/cardfed/core/Game.java
package io.cardfed.core;

import java.util.Locale;

/**
 * Game series known to the federation, with the tag used on the wire.
 */
public enum Game {
    BISHI_BASHI("bishi"),
    DDR("ddr"),
    IIDX("iidx"),
    JUBEAT("jubeat"),
    MUSECA("museca"),
    POPN_MUSIC("pnm"),
    REFLEC_BEAT("reflec"),
    SDVX("sdvx");

    private final String tag;

    Game(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Game fromTag(String tag) {
        if (tag == null) throw new IllegalArgumentException("game tag must not be null");
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (Game g : values()) {
            if (g.tag.equals(t)) return g;
        }
        throw new IllegalArgumentException("unknown game: " + tag);
    }
}
