package io.cardfed.server.federation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies static federation membership can be loaded from JSON.
 */
class FederationConfigJsonTest {

    @TempDir
    Path tmp;

    private Path write(String json) throws Exception {
        Path file = tmp.resolve("federation.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void loads_peers_in_order_with_policy_and_timeouts() throws Exception {
        Path file = write("""
                {
                  "localServerId": "server-a",
                  "peerFailurePolicy": "fail",
                  "peers": [
                    {"peerId": "server-c", "baseUrl": "http://localhost:8083", "timeoutMillis": 500},
                    {"peerId": "server-b", "baseUrl": "http://localhost:8082"}
                  ]
                }
                """);

        FederationConfig cfg = FederationConfig.fromJsonFile(file);

        assertEquals("server-a", cfg.localServerId());
        assertEquals(PeerFailurePolicy.FAIL, cfg.failurePolicy());
        assertEquals(List.of("server-c", "server-b"),
                cfg.peers().stream().map(FederationConfig.Peer::peerId).toList());

        FederationConfig.Peer c = cfg.peers().get(0);
        assertEquals(URI.create("http://localhost:8083"), c.baseUri());
        assertEquals(Duration.ofMillis(500), c.timeout());
        assertEquals(FederationConfig.DEFAULT_TIMEOUT, cfg.peers().get(1).timeout());
    }

    @Test
    void missing_policy_and_peers_mean_degrade_standalone() throws Exception {
        FederationConfig cfg = FederationConfig.fromJsonFile(write("""
                { "localServerId": "solo" }
                """));

        assertEquals(PeerFailurePolicy.DEGRADE, cfg.failurePolicy());
        assertTrue(cfg.peers().isEmpty());
    }

    @Test
    void override_replaces_local_server_id() throws Exception {
        Path file = write("""
                {
                  "localServerId": "server-a",
                  "peers": [ {"peerId": "server-b", "baseUrl": "http://localhost:8082"} ]
                }
                """);

        assertEquals("server-z", FederationConfig.fromJsonFile(file, "server-z").localServerId());
        assertEquals("server-a", FederationConfig.fromJsonFile(file, null).localServerId());
    }

    @Test
    void rejects_listing_itself_as_peer() throws Exception {
        Path file = write("""
                {
                  "localServerId": "server-a",
                  "peers": [ {"peerId": "server-a", "baseUrl": "http://localhost:8081"} ]
                }
                """);

        assertThrows(IllegalArgumentException.class, () -> FederationConfig.fromJsonFile(file));
    }

    @Test
    void rejects_duplicate_peers_and_relative_urls() {
        var b = new FederationConfig.Peer("b", URI.create("http://localhost:1"), Duration.ofSeconds(1));
        assertThrows(IllegalArgumentException.class,
                () -> new FederationConfig("a", List.of(b, b), PeerFailurePolicy.DEGRADE));
        assertThrows(IllegalArgumentException.class,
                () -> new FederationConfig.Peer("c", URI.create("/relative"), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new FederationConfig.Peer("c", URI.create("http://localhost:1"), Duration.ZERO));
    }

    @Test
    void unknown_policy_is_rejected() throws Exception {
        Path file = write("""
                { "localServerId": "server-a", "peerFailurePolicy": "retry" }
                """);

        assertThrows(IllegalArgumentException.class, () -> FederationConfig.fromJsonFile(file));
    }

    @Test
    void missing_file_is_unchecked_io() {
        assertThrows(UncheckedIOException.class,
                () -> FederationConfig.fromJsonFile(tmp.resolve("nope.json")));
    }
}
