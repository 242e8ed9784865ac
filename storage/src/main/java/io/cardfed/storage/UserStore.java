// file: storage/src/main/java/io/cardfed/storage/UserStore.java
package io.cardfed.storage;

import io.cardfed.core.CanonicalProfile;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.core.UserId;

import java.util.List;
import java.util.Optional;

/**
 * Local user/profile store consumed by the federation layer.
 * <p>
 * Semantics:
 *  - "Not found" is always an empty Optional or a null profile, never an exception.
 *  - getRefId/getExtId mint a stable id the first time they are asked, for local
 *    and virtual users alike, and must not fail for a valid user id.
 *  - Implementations must be safe to call from several threads at once; the
 *    federation layer queries the store concurrently with peer fan-out.
 */
public interface UserStore {

    // ----- read side used by the reconciliation engine -----

    String getRefId(Game game, int version, UserId userId);

    int getExtId(Game game, int version, UserId userId);

    /** Profile for exactly this game/version. */
    Optional<CanonicalProfile> getProfile(Game game, int version, UserId userId);

    /**
     * Profile for this game/version if stored, else the most recent other version
     * of the same game. The returned profile reports the version it was stored under.
     */
    Optional<CanonicalProfile> getAnyProfile(Game game, int version, UserId userId);

    /** {@link #getAnyProfile} for each id, in input order; missing profiles are null. */
    List<UserProfile> getAnyProfiles(Game game, int version, List<UserId> userIds);

    List<CardBinding> getAllCards();

    /** Every stored profile for exactly this game/version. */
    List<UserProfile> getAllProfiles(Game game, int version);

    Optional<UserId> fromCardId(CardId card);

    Optional<UserId> fromRefId(Game game, int version, String refId);

    Optional<UserId> fromExtId(Game game, int version, int extId);

    // ----- write side and peer-serving reads -----

    /**
     * Create a new local user owning {@code card}.
     *
     * @throws IllegalArgumentException if the card already belongs to a user
     */
    UserId createUser(CardId card);

    /**
     * Attach an additional card to an existing local user.
     *
     * @throws IllegalArgumentException if the user is unknown or the card is taken
     */
    void addCard(UserId userId, CardId card);

    /**
     * Store (or replace) the raw profile of a local user.
     *
     * @throws IllegalArgumentException for virtual or unknown users
     */
    void putProfile(Game game, int version, UserId userId, RawProfile profile);

    List<CardId> getCards(UserId userId);

    /**
     * Raw stored profile; with {@code exact=false} falls back to the most recent
     * other version of the game, like {@link #getAnyProfile}.
     */
    Optional<StoredProfile> getStoredProfile(Game game, int version, UserId userId, boolean exact);

    List<StoredProfile> getStoredProfiles(Game game, int version);

    // ----- DTOs -----

    /** A user and its profile; {@code profile} is null when none was found. */
    record UserProfile(UserId userId, CanonicalProfile profile) {
        public boolean found() {
            return profile != null;
        }
    }

    record CardBinding(CardId card, UserId userId) {}

    record StoredProfile(UserId userId, Game game, int version, RawProfile data) {}
}
