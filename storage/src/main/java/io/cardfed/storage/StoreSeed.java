// file: storage/src/main/java/io/cardfed/storage/StoreSeed.java
package io.cardfed.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.core.UserId;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Start-up fixture for a {@link UserStore}, loaded from JSON:
 * <pre>
 * {
 *   "users": [
 *     {
 *       "cards": ["E004010000000001"],
 *       "profiles": [
 *         { "game": "iidx", "version": 25, "data": { "name": "ALICE", "area": 13 } }
 *       ]
 *     }
 *   ]
 * }
 * </pre>
 * Users are created in file order; the first card creates the user and the rest
 * are attached to it.
 */
public final class StoreSeed {

    public List<SeedUser> users = List.of();

    public static final class SeedUser {
        public List<String> cards = List.of();
        public List<SeedProfile> profiles = List.of();
    }

    public static final class SeedProfile {
        public String game;
        public int version;
        public Map<String, Object> data = Map.of();
    }

    public static StoreSeed fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            StoreSeed seed = mapper.readValue(path.toFile(), StoreSeed.class);
            return seed.users == null ? new StoreSeed() : seed;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load store seed from " + path, e);
        }
    }

    /**
     * Create every seeded user and profile in {@code store}.
     *
     * @return number of users created
     * @throws IllegalArgumentException for users without cards, unknown games or duplicate cards
     */
    public int applyTo(UserStore store) {
        int created = 0;
        for (SeedUser u : users) {
            if (u.cards == null || u.cards.isEmpty()) {
                throw new IllegalArgumentException("seed user #" + created + " has no cards");
            }
            UserId id = store.createUser(CardId.of(u.cards.get(0)));
            for (String extra : u.cards.subList(1, u.cards.size())) {
                store.addCard(id, CardId.of(extra));
            }
            if (u.profiles != null) {
                for (SeedProfile p : u.profiles) {
                    Map<String, Object> data = p.data == null ? Map.of() : p.data;
                    store.putProfile(Game.fromTag(p.game), p.version, id, new RawProfile(data));
                }
            }
            created++;
        }
        return created;
    }
}
