package io.cardfed.server.federation;

import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.server.peer.IdType;
import io.cardfed.server.peer.PeerClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * PeerClient returning pre-defined records (or a pre-defined failure),
 * recording every call it receives.
 */
final class ScriptedPeerClient implements PeerClient {

    record Call(Game game, int version, IdType idType, List<CardId> ids) {}

    private final String peerId;
    private final List<RawProfile> records;
    private final RuntimeException failure;
    private final long delayMillis;
    private final CountDownLatch started = new CountDownLatch(1);
    final List<Call> calls = new CopyOnWriteArrayList<>();

    private ScriptedPeerClient(String peerId, List<RawProfile> records, RuntimeException failure, long delayMillis) {
        this.peerId = peerId;
        this.records = records;
        this.failure = failure;
        this.delayMillis = delayMillis;
    }

    static ScriptedPeerClient answering(String peerId, RawProfile... records) {
        return new ScriptedPeerClient(peerId, List.of(records), null, 0);
    }

    static ScriptedPeerClient slow(String peerId, long delayMillis, RawProfile... records) {
        return new ScriptedPeerClient(peerId, List.of(records), null, delayMillis);
    }

    static ScriptedPeerClient failing(String peerId, RuntimeException failure) {
        return new ScriptedPeerClient(peerId, List.of(), failure, 0);
    }

    /** Raw peer record with the given name, match marker (null for none) and cards. */
    static RawProfile record(String name, String match, String... cards) {
        Map<String, Object> m = new HashMap<>();
        m.put("name", name);
        if (match != null) m.put("match", match);
        m.put("cards", new ArrayList<>(List.of(cards)));
        return new RawProfile(m);
    }

    CountDownLatch started() {
        return started;
    }

    @Override
    public String peerId() {
        return peerId;
    }

    @Override
    public List<RawProfile> getProfiles(Game game, int version, IdType idType, List<CardId> ids) {
        calls.add(new Call(game, version, idType, List.copyOf(ids)));
        started.countDown();
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return records;
    }
}
