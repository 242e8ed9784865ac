// file: server/src/main/java/io/cardfed/server/peer/LocalPeerClient.java
package io.cardfed.server.peer;

import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;

import java.util.List;
import java.util.Objects;

/**
 * PeerClient that answers in-process through a {@link PeerProfileService}
 * (no network).
 * <br>
 * Used when:
 *  - a node is configured to federate with a store living in the same JVM,
 *  - or in tests where you don't want to spin up HTTP servers.
 */
public final class LocalPeerClient implements PeerClient {

    private final String peerId;
    private final PeerProfileService service;

    public LocalPeerClient(String peerId, PeerProfileService service) {
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public String peerId() {
        return peerId;
    }

    @Override
    public List<RawProfile> getProfiles(Game game, int version, IdType idType, List<CardId> ids) {
        return service.answer(game, version, idType, ids);
    }
}
