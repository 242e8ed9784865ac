// file: server/src/main/java/io/cardfed/server/federation/ProfileReconciler.java
package io.cardfed.server.federation;

import io.cardfed.core.CanonicalProfile;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.GameKey;
import io.cardfed.core.MatchQuality;
import io.cardfed.core.RawProfile;
import io.cardfed.core.UserId;
import io.cardfed.core.normalize.ProfileNormalizer;
import io.cardfed.server.peer.PeerUnavailableException;
import io.cardfed.storage.UserStore;
import io.cardfed.storage.UserStore.CardBinding;
import io.cardfed.storage.UserStore.UserProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Federation-aware profile lookups sitting above the local {@link UserStore}.
 *
 * Responsibilities:
 *  - Serve local users straight from the store.
 *  - Serve virtual (card-only) users from peers, picking the first record in
 *    peer order that lists the user's card.
 *  - Merge local and remote results for batch and "everyone" queries, running the
 *    store lookups on the shared executor while the peer fan-out runs from the
 *    calling thread.
 *  - Under {@link PeerFailurePolicy#DEGRADE}, a failed fan-out next to outstanding
 *    local lookups yields the local results only.
 *
 * Match rules for remote records:
 *  - "match" is "exact" or anything else (partial, the default).
 *  - Strict lookups skip partial records and keep scanning.
 *  - A partial record is reported with version {@value GameKey#UNKNOWN_VERSION}.
 *  - "cards" and "match" are envelope fields and never reach the normalizer.
 */
public final class ProfileReconciler {

    private static final Logger log = Logger.getLogger(ProfileReconciler.class.getName());

    private final UserStore store;
    private final IdentityMapper identities;
    private final RemoteFetchOrchestrator remote;
    private final ProfileNormalizer normalizer;

    public ProfileReconciler(
            UserStore store,
            IdentityMapper identities,
            RemoteFetchOrchestrator remote,
            ProfileNormalizer normalizer
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    // ---------- identity lookups ----------

    public UserId fromCard(CardId card) {
        return identities.resolveCard(card);
    }

    public Optional<UserId> fromRefId(Game game, int version, String refId) {
        return identities.fromRefId(game, version, refId);
    }

    public Optional<UserId> fromExtId(Game game, int version, int extId) {
        return identities.fromExtId(game, version, extId);
    }

    // ---------- single user ----------

    /** Profile for exactly this game/version; remote partial matches are ignored. */
    public Optional<CanonicalProfile> getProfile(Game game, int version, UserId userId) {
        if (!identities.isVirtual(userId)) {
            return store.getProfile(game, version, userId);
        }
        return remoteProfile(game, version, userId, true);
    }

    /** Profile for this game/version, or the closest one a peer or the store can offer. */
    public Optional<CanonicalProfile> getAnyProfile(Game game, int version, UserId userId) {
        if (!identities.isVirtual(userId)) {
            return store.getAnyProfile(game, version, userId);
        }
        return remoteProfile(game, version, userId, false);
    }

    private Optional<CanonicalProfile> remoteProfile(Game game, int version, UserId userId, boolean strict) {
        CardId card = identities.virtualToCard(userId);
        String refId = store.getRefId(game, version, userId);
        int extId = store.getExtId(game, version, userId);

        for (RawProfile record : remote.fetchByCards(game, version, List.of(card))) {
            if (!record.cards().contains(card)) continue;

            MatchQuality match = record.match();
            if (strict && match != MatchQuality.EXACT) {
                // Partial match, not for this version; a later peer may still be exact.
                continue;
            }
            return Optional.of(toCanonical(record, game, version, match, refId, extId));
        }
        return Optional.empty();
    }

    // ---------- batch ----------

    /**
     * Any-version profiles for a mix of local and virtual users.
     * <p>
     * Output order: the store's answers for local users, then virtual users matched
     * by peers in peer-response order, then virtual users nobody knew (profile null).
     * A virtual user is matched by the first record listing its card; later
     * records for the same card are ignored.
     */
    public List<UserProfile> getAnyProfiles(Game game, int version, List<UserId> userIds) {
        if (userIds.isEmpty()) {
            return List.of();
        }

        List<UserId> localIds = new ArrayList<>();
        Map<CardId, UserId> remaining = new LinkedHashMap<>();
        for (UserId id : userIds) {
            if (identities.isVirtual(id)) {
                remaining.put(identities.virtualToCard(id), id);
            } else {
                localIds.add(id);
            }
        }

        if (remaining.isEmpty()) {
            return store.getAnyProfiles(game, version, localIds);
        }

        List<CardId> cards = List.copyOf(remaining.keySet());
        TaskGroup group = new TaskGroup(remote.executor());
        Future<List<UserProfile>> localF = group.fork(() -> store.getAnyProfiles(game, version, localIds));
        List<RawProfile> records = group.joinAfter(() -> localIds.isEmpty()
                ? remote.fetchByCards(game, version, cards)
                : besideLocal(() -> remote.fetchByCards(game, version, cards), game, version));

        List<UserProfile> out = new ArrayList<>(TaskGroup.resultOf(localF));
        for (RawProfile record : records) {
            // One record may answer several requested cards; each gets its own profile.
            for (CardId card : record.cards()) {
                UserId userId = remaining.remove(card);
                if (userId == null) continue;

                String refId = store.getRefId(game, version, userId);
                int extId = store.getExtId(game, version, userId);
                out.add(new UserProfile(userId, toCanonical(record, game, version, record.match(), refId, extId)));
            }
        }

        for (UserId unmatched : remaining.values()) {
            out.add(new UserProfile(unmatched, null));
        }
        return out;
    }

    // ---------- everyone ----------

    /**
     * Every local profile for the game/version plus every remote-only user a peer
     * reports with an exact match.
     * <p>
     * Remote records are dropped when they:
     *  - list no cards,
     *  - list any card the local store knows (local data wins),
     *  - are not exact matches.
     * A kept record becomes the virtual user of its lexicographically smallest card.
     */
    public List<UserProfile> getAllProfiles(Game game, int version) {
        TaskGroup group = new TaskGroup(remote.executor());
        Future<List<CardBinding>> cardsF = group.fork(store::getAllCards);
        Future<List<UserProfile>> localF = group.fork(() -> store.getAllProfiles(game, version));
        List<RawProfile> records = group.joinAfter(() -> besideLocal(() -> remote.fetchAll(game, version), game, version));

        Map<CardId, UserId> cardToLocal = new HashMap<>();
        for (CardBinding b : TaskGroup.resultOf(cardsF)) {
            cardToLocal.put(b.card(), b.userId());
        }

        Map<UserId, CanonicalProfile> byUser = new LinkedHashMap<>();
        for (UserProfile up : TaskGroup.resultOf(localF)) {
            byUser.put(up.userId(), up.profile());
        }

        for (RawProfile record : records) {
            List<CardId> cards = new ArrayList<>(record.cards());
            if (cards.isEmpty()) continue;
            cards.sort(Comparator.naturalOrder());

            if (cards.stream().anyMatch(cardToLocal::containsKey)) continue;
            if (record.match() != MatchQuality.EXACT) continue;

            UserId virtual = identities.cardToVirtual(cards.get(0));
            String refId = store.getRefId(game, version, virtual);
            int extId = store.getExtId(game, version, virtual);
            byUser.put(virtual, toCanonical(record, game, version, MatchQuality.EXACT, refId, extId));
        }

        List<UserProfile> out = new ArrayList<>(byUser.size());
        byUser.forEach((id, profile) -> out.add(new UserProfile(id, profile)));
        return out;
    }

    // ---------- helpers ----------

    /**
     * Remote half of a merge that also has local lookups in flight. The fan-out
     * only raises under DEGRADE when its single peer failed; the local half is
     * still served then.
     */
    private List<RawProfile> besideLocal(Supplier<List<RawProfile>> fetch, Game game, int version) {
        try {
            return fetch.get();
        } catch (PeerUnavailableException e) {
            if (remote.failurePolicy() != PeerFailurePolicy.DEGRADE) throw e;
            log.log(Level.WARNING, String.format("serving local profiles only for %s/%d: peer %s failed",
                    game.tag(), version, e.peerId()));
            return List.of();
        }
    }

    private CanonicalProfile toCanonical(
            RawProfile record,
            Game game,
            int version,
            MatchQuality match,
            String refId,
            int extId
    ) {
        RawProfile payload = record.without(RawProfile.CARDS, RawProfile.MATCH);
        int reported = match == MatchQuality.EXACT ? version : GameKey.UNKNOWN_VERSION;
        return normalizer.normalize(payload, game, reported, refId, extId);
    }
}
