package io.cardfed.core.normalize;

import io.cardfed.core.RawProfile;

import java.util.Map;

/**
 * Pure function from a raw profile to the game-specific fields of its
 * canonical form. Implementations must not throw on malformed input:
 * anything unreadable is simply left out.
 */
@FunctionalInterface
public interface GameFieldExtractor {

    GameFieldExtractor NONE = raw -> Map.of();

    Map<String, Object> extract(RawProfile raw);
}
