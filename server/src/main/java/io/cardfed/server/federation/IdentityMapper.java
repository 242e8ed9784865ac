// file: server/src/main/java/io/cardfed/server/federation/IdentityMapper.java
package io.cardfed.server.federation;

import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RemoteUsers;
import io.cardfed.core.UserId;
import io.cardfed.storage.UserStore;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps between card ids and user ids, preferring the local store and falling
 * back to virtual ids for cards the store does not know.
 */
public final class IdentityMapper {

    private final UserStore store;

    public IdentityMapper(UserStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** Local owner of the card, else the card's virtual id. Never fails. */
    public UserId resolveCard(CardId card) {
        return store.fromCardId(card).orElseGet(() -> RemoteUsers.cardToUserId(card));
    }

    public boolean isVirtual(UserId userId) {
        return RemoteUsers.isRemote(userId);
    }

    /** @throws io.cardfed.core.InvariantViolationException for local ids */
    public CardId virtualToCard(UserId userId) {
        return RemoteUsers.userIdToCard(userId);
    }

    public UserId cardToVirtual(CardId card) {
        return RemoteUsers.cardToUserId(card);
    }

    public Optional<UserId> fromRefId(Game game, int version, String refId) {
        return store.fromRefId(game, version, refId);
    }

    public Optional<UserId> fromExtId(Game game, int version, int extId) {
        return store.fromExtId(game, version, extId);
    }
}
