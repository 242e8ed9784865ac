// file: server/src/main/java/io/cardfed/server/federation/FederationMetrics.java
package io.cardfed.server.federation;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory fan-out metrics.
 *
 * Tracks:
 *  - fanOuts:        fan-out operations started.
 *  - peerCalls:      individual peer calls attempted.
 *  - peerFailures:   peer calls that threw, in total and per peer.
 *  - recordsFetched: raw records returned by successful peer calls.
 */
public final class FederationMetrics {

    private final AtomicLong fanOuts = new AtomicLong();
    private final AtomicLong peerCalls = new AtomicLong();
    private final AtomicLong peerFailures = new AtomicLong();
    private final AtomicLong recordsFetched = new AtomicLong();
    private final Map<String, AtomicLong> failuresByPeer = new ConcurrentHashMap<>();

    public void recordFanOut(int peers) {
        fanOuts.incrementAndGet();
        peerCalls.addAndGet(peers);
    }

    public void recordPeerSuccess(int records) {
        recordsFetched.addAndGet(records);
    }

    public void recordPeerFailure(String peerId) {
        peerFailures.incrementAndGet();
        failuresByPeer.computeIfAbsent(peerId, k -> new AtomicLong()).incrementAndGet();
    }

    public Snapshot snapshot() {
        Map<String, Long> byPeer = new TreeMap<>();
        failuresByPeer.forEach((k, v) -> byPeer.put(k, v.get()));
        return new Snapshot(
                fanOuts.get(),
                peerCalls.get(),
                peerFailures.get(),
                recordsFetched.get(),
                Map.copyOf(byPeer)
        );
    }

    public record Snapshot(
            long fanOuts,
            long peerCalls,
            long peerFailures,
            long recordsFetched,
            Map<String, Long> failuresByPeer
    ) {}
}
