package io.cardfed.core;

import java.util.Objects;

/**
 * A specific release of a game. Version {@value #UNKNOWN_VERSION} is reserved for
 * "version not confirmed", which is what a partial peer match reports.
 */
public record GameKey(Game game, int version) {

    public static final int UNKNOWN_VERSION = 0;

    public GameKey {
        Objects.requireNonNull(game, "game");
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
    }
}
