// file: server/src/main/java/io/cardfed/server/peer/PeerProfileService.java
package io.cardfed.server.peer;

import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.MatchQuality;
import io.cardfed.core.RawProfile;
import io.cardfed.core.UserId;
import io.cardfed.storage.UserStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Answers other nodes' peer queries from this node's local store.
 * <p>
 * Rules:
 *  - CARD: for each requested card owned by a local user, that user's stored profile
 *    for the exact version ("match": "exact"), else for the newest other version of
 *    the game ("match": "partial"). Each user is answered at most once, in
 *    request order; users without any profile of the game are skipped.
 *  - SERVER: every stored profile for exactly this game/version, marked "exact".
 * <p>
 * Every record carries all of its owner's cards under "cards". Only local data is
 * served: answers never include profiles this node learned from its own peers.
 */
public final class PeerProfileService {

    private final UserStore store;

    public PeerProfileService(UserStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public List<RawProfile> answer(Game game, int version, IdType idType, List<CardId> ids) {
        return switch (idType) {
            case CARD -> byCards(game, version, ids);
            case SERVER -> everyone(game, version);
        };
    }

    private List<RawProfile> byCards(Game game, int version, List<CardId> cards) {
        Set<UserId> seen = new LinkedHashSet<>();
        List<RawProfile> out = new ArrayList<>();
        for (CardId card : cards) {
            Optional<UserId> owner = store.fromCardId(card);
            if (owner.isEmpty() || !seen.add(owner.get())) continue;

            store.getStoredProfile(game, version, owner.get(), false).ifPresent(sp -> {
                MatchQuality match = sp.version() == version ? MatchQuality.EXACT : MatchQuality.PARTIAL;
                out.add(envelope(sp, match));
            });
        }
        return out;
    }

    private List<RawProfile> everyone(Game game, int version) {
        List<RawProfile> out = new ArrayList<>();
        for (UserStore.StoredProfile sp : store.getStoredProfiles(game, version)) {
            out.add(envelope(sp, MatchQuality.EXACT));
        }
        return out;
    }

    private RawProfile envelope(UserStore.StoredProfile sp, MatchQuality match) {
        List<String> cards = store.getCards(sp.userId()).stream().map(CardId::value).toList();
        return sp.data()
                .with(RawProfile.CARDS, cards)
                .with(RawProfile.MATCH, match.wire());
    }
}
