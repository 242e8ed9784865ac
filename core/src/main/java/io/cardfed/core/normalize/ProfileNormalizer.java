// file: core/src/main/java/io/cardfed/core/normalize/ProfileNormalizer.java
package io.cardfed.core.normalize;

import io.cardfed.core.CanonicalProfile;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw profile payloads into {@link CanonicalProfile}s.
 * <p>
 * The fixed fields come from the caller (game, version, refId, extId) and from the
 * payload's "name" (default ""). Game-specific fields are produced by a table of
 * {@link GameFieldExtractor}s keyed by game; games without an entry get no extras.
 * <p>
 * Thread-safe: the table is immutable after construction.
 */
public final class ProfileNormalizer {

    private final Map<Game, GameFieldExtractor> extractors;

    public ProfileNormalizer() {
        this(GameExtractors.defaults());
    }

    public ProfileNormalizer(Map<Game, GameFieldExtractor> extractors) {
        Objects.requireNonNull(extractors, "extractors");
        this.extractors = extractors.isEmpty()
                ? new EnumMap<>(Game.class)
                : new EnumMap<>(extractors);
    }

    /** Copy of this normalizer with the extractor for {@code game} replaced or added. */
    public ProfileNormalizer withExtractor(Game game, GameFieldExtractor extractor) {
        Map<Game, GameFieldExtractor> copy = new EnumMap<>(Game.class);
        copy.putAll(extractors);
        copy.put(Objects.requireNonNull(game, "game"), Objects.requireNonNull(extractor, "extractor"));
        return new ProfileNormalizer(copy);
    }

    public CanonicalProfile normalize(RawProfile raw, Game game, int version, String refId, int extId) {
        Objects.requireNonNull(raw, "raw");
        String name = raw.string(CanonicalProfile.NAME).orElse("");
        Map<String, Object> extras = extractors.getOrDefault(game, GameFieldExtractor.NONE).extract(raw);
        return new CanonicalProfile(name, game, version, refId, extId, extras);
    }
}
