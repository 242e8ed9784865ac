// file: server/src/main/java/io/cardfed/server/federation/FederationConfig.java
package io.cardfed.server.federation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfed.server.dto.JsonFederationConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static federation membership: which peers this server queries, in which order,
 * and how peer failures are treated.
 * <p>
 * Peer order is significant: fan-out results are concatenated in this order and
 * the first matching record wins.
 */
public final class FederationConfig {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    public record Peer(
            String peerId,
            URI baseUri,
            Duration timeout
    ) {
        public Peer {
            Objects.requireNonNull(peerId, "peerId");
            Objects.requireNonNull(baseUri, "baseUri");
            Objects.requireNonNull(timeout, "timeout");
            if (peerId.isBlank()) throw new IllegalArgumentException("peerId must not be blank");
            if (baseUri.getScheme() == null || baseUri.getHost() == null) {
                throw new IllegalArgumentException("peer " + peerId + " baseUrl must be absolute: " + baseUri);
            }
            if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    private final String localServerId;
    private final List<Peer> peers;
    private final PeerFailurePolicy failurePolicy;

    public FederationConfig(String localServerId, List<Peer> peers, PeerFailurePolicy failurePolicy) {
        this.localServerId = Objects.requireNonNull(localServerId, "localServerId");
        this.peers = List.copyOf(Objects.requireNonNull(peers, "peers"));
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");

        Set<String> ids = new HashSet<>();
        for (Peer p : this.peers) {
            if (!ids.add(p.peerId())) throw new IllegalArgumentException("duplicate peerId " + p.peerId());
            if (p.peerId().equals(localServerId)) {
                throw new IllegalArgumentException("server " + localServerId + " must not list itself as a peer");
            }
        }
    }

    /** A server with no peers: every query is answered locally. */
    public static FederationConfig standalone(String localServerId) {
        return new FederationConfig(localServerId, List.of(), PeerFailurePolicy.DEGRADE);
    }

    public static FederationConfig fromJsonFile(Path path) {
        return fromJsonFile(path, null);
    }

    /** Lets Main override localServerId with the CLI --server-id. */
    public static FederationConfig fromJsonFile(Path path, String overrideLocalServerId) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonFederationConfig cfg = mapper.readValue(path.toFile(), JsonFederationConfig.class);
            List<Peer> peerList = cfg.peers == null ? List.of() : cfg.peers.stream()
                    .map(p -> new Peer(
                            p.peerId,
                            URI.create(Objects.requireNonNull(p.baseUrl, "baseUrl")),
                            p.timeoutMillis > 0 ? Duration.ofMillis(p.timeoutMillis) : DEFAULT_TIMEOUT))
                    .toList();

            String localId = (overrideLocalServerId != null && !overrideLocalServerId.isBlank())
                    ? overrideLocalServerId
                    : cfg.localServerId;

            return new FederationConfig(localId, peerList, PeerFailurePolicy.fromString(cfg.peerFailurePolicy));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load FederationConfig from " + path, e);
        }
    }

    public String localServerId() {
        return localServerId;
    }

    public List<Peer> peers() {
        return peers;
    }

    public PeerFailurePolicy failurePolicy() {
        return failurePolicy;
    }
}
