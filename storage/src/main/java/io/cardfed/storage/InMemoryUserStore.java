// file: storage/src/main/java/io/cardfed/storage/InMemoryUserStore.java
package io.cardfed.storage;

import io.cardfed.core.CanonicalProfile;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.GameKey;
import io.cardfed.core.RawProfile;
import io.cardfed.core.RemoteUsers;
import io.cardfed.core.UserId;
import io.cardfed.core.normalize.ProfileNormalizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Reference UserStore that keeps everything in memory.
 * <p>
 * Layout:
 *  - card -> user and user -> cards, in insertion order,
 *  - (game, version) -> user -> raw profile,
 *  - (game, version) -> user <-> refId / extId, minted lazily.
 * <p>
 * Profiles are stored raw and normalized on every read, so callers always get a
 * fresh CanonicalProfile. All public methods are synchronized.
 */
public class InMemoryUserStore implements UserStore {

    private static final int MIN_EXT_ID = 10_000_000;
    private static final int EXT_ID_SPAN = 90_000_000;

    private final ProfileNormalizer normalizer;
    private final Random random;

    private long nextUserId = 1;
    private final Map<CardId, UserId> cardToUser = new LinkedHashMap<>();
    private final Map<UserId, List<CardId>> userCards = new HashMap<>();
    private final Map<GameKey, Map<UserId, RawProfile>> profiles = new HashMap<>();
    private final Map<GameKey, IdIndex<String>> refIds = new HashMap<>();
    private final Map<GameKey, IdIndex<Integer>> extIds = new HashMap<>();

    public InMemoryUserStore() {
        this(new ProfileNormalizer(), new Random());
    }

    /** Test constructor: fixed seed gives reproducible ref/ext ids. */
    public InMemoryUserStore(ProfileNormalizer normalizer, Random random) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.random = Objects.requireNonNull(random, "random");
    }

    // ---------- ids ----------

    @Override
    public synchronized String getRefId(Game game, int version, UserId userId) {
        IdIndex<String> idx = refIds.computeIfAbsent(new GameKey(game, version), k -> new IdIndex<>());
        String existing = idx.byUser.get(userId);
        if (existing != null) return existing;

        String minted;
        do {
            minted = String.format("%016X", random.nextLong());
        } while (idx.byId.containsKey(minted));
        idx.put(userId, minted);
        return minted;
    }

    @Override
    public synchronized int getExtId(Game game, int version, UserId userId) {
        IdIndex<Integer> idx = extIds.computeIfAbsent(new GameKey(game, version), k -> new IdIndex<>());
        Integer existing = idx.byUser.get(userId);
        if (existing != null) return existing;

        int minted;
        do {
            minted = MIN_EXT_ID + random.nextInt(EXT_ID_SPAN);
        } while (idx.byId.containsKey(minted));
        idx.put(userId, minted);
        return minted;
    }

    @Override
    public synchronized Optional<UserId> fromRefId(Game game, int version, String refId) {
        IdIndex<String> idx = refIds.get(new GameKey(game, version));
        return idx == null ? Optional.empty() : Optional.ofNullable(idx.byId.get(refId));
    }

    @Override
    public synchronized Optional<UserId> fromExtId(Game game, int version, int extId) {
        IdIndex<Integer> idx = extIds.get(new GameKey(game, version));
        return idx == null ? Optional.empty() : Optional.ofNullable(idx.byId.get(extId));
    }

    @Override
    public synchronized Optional<UserId> fromCardId(CardId card) {
        return Optional.ofNullable(cardToUser.get(card));
    }

    // ---------- profiles ----------

    @Override
    public synchronized Optional<CanonicalProfile> getProfile(Game game, int version, UserId userId) {
        return getStoredProfile(game, version, userId, true).map(this::toCanonical);
    }

    @Override
    public synchronized Optional<CanonicalProfile> getAnyProfile(Game game, int version, UserId userId) {
        return getStoredProfile(game, version, userId, false).map(this::toCanonical);
    }

    @Override
    public synchronized List<UserProfile> getAnyProfiles(Game game, int version, List<UserId> userIds) {
        List<UserProfile> out = new ArrayList<>(userIds.size());
        for (UserId id : userIds) {
            out.add(new UserProfile(id, getAnyProfile(game, version, id).orElse(null)));
        }
        return out;
    }

    @Override
    public synchronized List<CardBinding> getAllCards() {
        List<CardBinding> out = new ArrayList<>(cardToUser.size());
        cardToUser.forEach((card, user) -> out.add(new CardBinding(card, user)));
        return out;
    }

    @Override
    public synchronized List<UserProfile> getAllProfiles(Game game, int version) {
        List<UserProfile> out = new ArrayList<>();
        for (StoredProfile sp : getStoredProfiles(game, version)) {
            out.add(new UserProfile(sp.userId(), toCanonical(sp)));
        }
        return out;
    }

    @Override
    public synchronized Optional<StoredProfile> getStoredProfile(Game game, int version, UserId userId, boolean exact) {
        Map<UserId, RawProfile> exactVersion = profiles.get(new GameKey(game, version));
        if (exactVersion != null && exactVersion.containsKey(userId)) {
            return Optional.of(new StoredProfile(userId, game, version, exactVersion.get(userId)));
        }
        if (exact) {
            return Optional.empty();
        }

        // Fall back to the newest other version of the same game.
        StoredProfile best = null;
        for (Map.Entry<GameKey, Map<UserId, RawProfile>> e : profiles.entrySet()) {
            GameKey key = e.getKey();
            RawProfile raw = e.getValue().get(userId);
            if (key.game() != game || raw == null) continue;
            if (best == null || key.version() > best.version()) {
                best = new StoredProfile(userId, game, key.version(), raw);
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public synchronized List<StoredProfile> getStoredProfiles(Game game, int version) {
        Map<UserId, RawProfile> byUser = profiles.get(new GameKey(game, version));
        if (byUser == null) return List.of();
        List<StoredProfile> out = new ArrayList<>(byUser.size());
        byUser.forEach((user, raw) -> out.add(new StoredProfile(user, game, version, raw)));
        return out;
    }

    // ---------- writes ----------

    @Override
    public synchronized UserId createUser(CardId card) {
        Objects.requireNonNull(card, "card");
        if (cardToUser.containsKey(card)) {
            throw new IllegalArgumentException("card " + card + " already belongs to " + cardToUser.get(card));
        }
        UserId id = UserId.local(nextUserId++);
        userCards.put(id, new ArrayList<>());
        bind(id, card);
        return id;
    }

    @Override
    public synchronized void addCard(UserId userId, CardId card) {
        requireLocalUser(userId);
        if (cardToUser.containsKey(card)) {
            throw new IllegalArgumentException("card " + card + " already belongs to " + cardToUser.get(card));
        }
        bind(userId, card);
    }

    @Override
    public synchronized void putProfile(Game game, int version, UserId userId, RawProfile profile) {
        Objects.requireNonNull(profile, "profile");
        requireLocalUser(userId);
        profiles.computeIfAbsent(new GameKey(game, version), k -> new LinkedHashMap<>()).put(userId, profile);
    }

    @Override
    public synchronized List<CardId> getCards(UserId userId) {
        List<CardId> cards = userCards.get(userId);
        return cards == null ? List.of() : List.copyOf(cards);
    }

    // ---------- helpers ----------

    private void bind(UserId userId, CardId card) {
        cardToUser.put(card, userId);
        userCards.get(userId).add(card);
    }

    private void requireLocalUser(UserId userId) {
        if (RemoteUsers.isRemote(userId)) {
            throw new IllegalArgumentException("virtual user " + userId + " cannot own local data");
        }
        if (!userCards.containsKey(userId)) {
            throw new IllegalArgumentException("unknown user " + userId);
        }
    }

    private CanonicalProfile toCanonical(StoredProfile sp) {
        String refId = getRefId(sp.game(), sp.version(), sp.userId());
        int extId = getExtId(sp.game(), sp.version(), sp.userId());
        return normalizer.normalize(sp.data(), sp.game(), sp.version(), refId, extId);
    }

    /** Bidirectional user <-> id map for one (game, version). */
    private static final class IdIndex<T> {
        final Map<UserId, T> byUser = new HashMap<>();
        final Map<T, UserId> byId = new HashMap<>();

        void put(UserId user, T id) {
            byUser.put(user, id);
            byId.put(id, user);
        }
    }
}
