// file: server/src/main/java/io/cardfed/server/federation/RemoteFetchOrchestrator.java
package io.cardfed.server.federation;

import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.server.peer.IdType;
import io.cardfed.server.peer.PeerClient;
import io.cardfed.server.peer.PeerUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans one query out to every configured peer and flattens the answers.
 *
 * Responsibilities:
 *  - Run one task per peer, all concurrently, on a shared executor.
 *  - Wait for every task before looking at any result.
 *  - Concatenate results in peer-configuration order, keeping each peer's own order.
 *  - Apply the {@link PeerFailurePolicy} to failed peers; log and count every failure.
 *
 * The executor is also lent to {@link ProfileReconciler} for its local store
 * lookups. Every task submitted to it is a leaf (a store or peer call); nothing
 * running on the executor waits for other tasks on it, so a bounded pool is safe.
 */
public final class RemoteFetchOrchestrator implements AutoCloseable {

    private static final Logger log = Logger.getLogger(RemoteFetchOrchestrator.class.getName());

    private final List<PeerClient> peers;
    private final PeerFailurePolicy failurePolicy;
    private final FederationMetrics metrics;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public RemoteFetchOrchestrator(List<PeerClient> peers, PeerFailurePolicy failurePolicy, FederationMetrics metrics) {
        this(peers, failurePolicy, metrics, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "peer-fanout-worker");
            t.setDaemon(true);
            return t;
        }), true);
    }

    /** Constructor for callers that manage the executor themselves. */
    public RemoteFetchOrchestrator(
            List<PeerClient> peers,
            PeerFailurePolicy failurePolicy,
            FederationMetrics metrics,
            ExecutorService executor
    ) {
        this(peers, failurePolicy, metrics, executor, false);
    }

    private RemoteFetchOrchestrator(
            List<PeerClient> peers,
            PeerFailurePolicy failurePolicy,
            FederationMetrics metrics,
            ExecutorService executor,
            boolean ownsExecutor
    ) {
        this.peers = List.copyOf(Objects.requireNonNull(peers, "peers"));
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    /** Profiles of users owning any of {@code cards}, from every peer. */
    public List<RawProfile> fetchByCards(Game game, int version, List<CardId> cards) {
        return fanOut(game, version, IdType.CARD, List.copyOf(cards));
    }

    /** Every profile every peer holds for the game/version. */
    public List<RawProfile> fetchAll(Game game, int version) {
        return fanOut(game, version, IdType.SERVER, List.of());
    }

    public int peerCount() {
        return peers.size();
    }

    public PeerFailurePolicy failurePolicy() {
        return failurePolicy;
    }

    ExecutorService executor() {
        return executor;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    // ---------- internals ----------

    private List<RawProfile> fanOut(Game game, int version, IdType idType, List<CardId> ids) {
        if (peers.isEmpty()) {
            return List.of();
        }
        metrics.recordFanOut(peers.size());

        TaskGroup group = new TaskGroup(executor);
        List<Future<PeerAnswer>> answers = new ArrayList<>(peers.size());
        for (PeerClient peer : peers) {
            answers.add(group.fork(() -> call(peer, game, version, idType, ids)));
        }
        // call() never throws, so join() only fails on interruption.
        group.join();

        List<RawProfile> flat = new ArrayList<>();
        List<PeerAnswer> failed = new ArrayList<>();
        for (Future<PeerAnswer> f : answers) {
            PeerAnswer a = TaskGroup.resultOf(f);
            if (a.failure() != null) {
                failed.add(a);
            } else {
                flat.addAll(a.records());
            }
        }

        if (!failed.isEmpty()) {
            for (PeerAnswer a : failed) {
                metrics.recordPeerFailure(a.peerId());
                log.log(Level.WARNING,
                        String.format("peer %s failed for %s/%d (%s): %s",
                                a.peerId(), game.tag(), version, idType.wire(), a.failure().getMessage()),
                        a.failure());
            }
            if (failurePolicy == PeerFailurePolicy.FAIL || peers.size() == 1) {
                PeerUnavailableException first = asUnavailable(failed.get(0));
                for (PeerAnswer other : failed.subList(1, failed.size())) {
                    if (other.failure() != first) first.addSuppressed(other.failure());
                }
                throw first;
            }
        }
        return flat;
    }

    private PeerAnswer call(PeerClient peer, Game game, int version, IdType idType, List<CardId> ids) {
        try {
            List<RawProfile> records = peer.getProfiles(game, version, idType, ids);
            List<RawProfile> safe = records == null ? List.of() : records;
            metrics.recordPeerSuccess(safe.size());
            return new PeerAnswer(peer.peerId(), safe, null);
        } catch (RuntimeException e) {
            return new PeerAnswer(peer.peerId(), List.of(), e);
        }
    }

    private static PeerUnavailableException asUnavailable(PeerAnswer a) {
        if (a.failure() instanceof PeerUnavailableException pue) {
            return pue;
        }
        return new PeerUnavailableException(a.peerId(), "peer " + a.peerId() + " failed", a.failure());
    }

    private record PeerAnswer(
            String peerId,
            List<RawProfile> records,
            RuntimeException failure
    ) {}
}
