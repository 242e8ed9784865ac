// file: server/src/main/java/io/cardfed/server/peer/PeerClient.java
package io.cardfed.server.peer;

import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;

import java.util.List;

/**
 * Client for querying one peer server of the federation.
 * <br>
 * This abstracts over the transport:
 *  - HttpPeerClient posts JSON to a remote node's peer endpoint.
 *  - LocalPeerClient answers in-process from a UserStore (loop-back and tests).
 * <br>
 * Calls are synchronous. Timeouts belong to the transport; a call that fails or
 * times out throws {@link PeerUnavailableException}.
 */
public interface PeerClient {

    /** Stable id used in logs and metrics. */
    String peerId();

    /**
     * Fetch raw profiles for a game/version.
     * <br>
     * Each returned record may carry:
     *  - "cards": every card id of the user the profile belongs to,
     *  - "match": "exact" when the profile is for exactly this version, else "partial".
     *
     * @param idType CARD to filter by {@code ids}, SERVER for all profiles
     * @param ids    card ids for CARD queries; ignored for SERVER
     */
    List<RawProfile> getProfiles(Game game, int version, IdType idType, List<CardId> ids);
}
