package io.cardfed.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.core.UserId;
import io.cardfed.core.normalize.ProfileNormalizer;
import io.cardfed.server.federation.FederationMetrics;
import io.cardfed.server.federation.IdentityMapper;
import io.cardfed.server.federation.PeerFailurePolicy;
import io.cardfed.server.federation.ProfileReconciler;
import io.cardfed.server.federation.RemoteFetchOrchestrator;
import io.cardfed.server.peer.HttpPeerClient;
import io.cardfed.server.peer.PeerClient;
import io.cardfed.server.peer.PeerProfileService;
import io.cardfed.storage.InMemoryUserStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs over real HTTP.
 *
 * Topology:
 *  - node A (18181): one local user ALICE, federates with node B over HTTP.
 *  - node B (18182): one local user BOB with an IIDX 25 profile, no peers.
 *  - node C (18183): federates with a single peer on a port nobody listens on.
 */
class WebServerFederationTest {

    private static final int PORT_A = 18181; // test-only ports
    private static final int PORT_B = 18182;
    private static final int PORT_C = 18183;
    private static final int PORT_DEAD = 18189;

    private static final String ALICE_CARD = "E004010000000A01";
    private static final String BOB_CARD = "E004010000000B01";

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final List<WebServer> servers = new ArrayList<>();
    private static final List<RemoteFetchOrchestrator> orchestrators = new ArrayList<>();
    private static HttpClient client;

    @BeforeAll
    static void startNodes() {
        InMemoryUserStore storeA = new InMemoryUserStore();
        UserId alice = storeA.createUser(CardId.of(ALICE_CARD));
        storeA.putProfile(Game.IIDX, 25, alice, new RawProfile(Map.of("name", "ALICE", "area", 7)));
        start(PORT_A, storeA, List.of(new HttpPeerClient("node-b", URI.create("http://localhost:" + PORT_B), Duration.ofSeconds(2))));

        InMemoryUserStore storeB = new InMemoryUserStore();
        UserId bob = storeB.createUser(CardId.of(BOB_CARD));
        storeB.putProfile(Game.IIDX, 25, bob, new RawProfile(Map.of(
                "name", "BOB",
                "area", 13,
                "qpro", Map.of("head", 2, "hair", -1))));
        start(PORT_B, storeB, List.of());

        start(PORT_C, new InMemoryUserStore(),
                List.of(new HttpPeerClient("node-dead", URI.create("http://localhost:" + PORT_DEAD), Duration.ofSeconds(1))));

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    private static void start(int port, InMemoryUserStore store, List<PeerClient> peers) {
        FederationMetrics metrics = new FederationMetrics();
        RemoteFetchOrchestrator orchestrator = new RemoteFetchOrchestrator(peers, PeerFailurePolicy.DEGRADE, metrics);
        ProfileReconciler reconciler = new ProfileReconciler(
                store, new IdentityMapper(store), orchestrator, new ProfileNormalizer());
        WebServer server = new WebServer(port, reconciler, new PeerProfileService(store), metrics);
        server.start();
        servers.add(server);
        orchestrators.add(orchestrator);
    }

    @AfterAll
    static void stopNodes() {
        servers.forEach(WebServer::stop);
        orchestrators.forEach(RemoteFetchOrchestrator::close);
    }

    private static HttpResponse<String> get(int port, String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + path))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> post(int port, String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static Map<String, Object> object(String body) throws Exception {
        return JSON.readValue(body, new TypeReference<>() {});
    }

    private static List<Map<String, Object>> array(String body) throws Exception {
        return JSON.readValue(body, new TypeReference<>() {});
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> profileOf(Map<String, Object> entry) {
        return (Map<String, Object>) entry.get("profile");
    }

    // ---------- federated reads ----------

    @Test
    void virtual_user_is_served_from_peer_and_normalized() throws Exception {
        HttpResponse<String> resp = get(PORT_A, "/profiles/iidx/25/users/-" + BOB_CARD);
        assertEquals(200, resp.statusCode());

        Map<String, Object> body = object(resp.body());
        assertEquals(true, body.get("found"));
        assertEquals("-" + BOB_CARD, body.get("userId"));

        Map<String, Object> profile = profileOf(body);
        assertEquals("BOB", profile.get("name"));
        assertEquals("iidx", profile.get("game"));
        assertEquals(25, profile.get("version"));
        assertEquals(13, profile.get("pid"));
        assertEquals(Map.of("head", 2), profile.get("qpro"));
        assertNotNull(profile.get("refid"));
        assertFalse(profile.containsKey("cards"));
        assertFalse(profile.containsKey("match"));
        assertFalse(profile.containsKey("area"));
    }

    @Test
    void partial_peer_match_is_hidden_from_strict_reads_only() throws Exception {
        HttpResponse<String> strict = get(PORT_A, "/profiles/iidx/26/users/-" + BOB_CARD);
        assertEquals(404, strict.statusCode());
        assertEquals(false, object(strict.body()).get("found"));

        HttpResponse<String> any = get(PORT_A, "/profiles/iidx/26/users/-" + BOB_CARD + "?any=true");
        assertEquals(200, any.statusCode());
        Map<String, Object> profile = profileOf(object(any.body()));
        assertEquals("BOB", profile.get("name"));
        assertEquals(0, profile.get("version"));
    }

    @Test
    void lookup_merges_local_remote_and_missing_users() throws Exception {
        HttpResponse<String> resp = post(PORT_A, "/profiles/iidx/25/lookup", """
                { "userIds": ["-E004010000000FFF", "-%s", "1"] }
                """.formatted(BOB_CARD));
        assertEquals(200, resp.statusCode());

        List<Map<String, Object>> entries = array(resp.body());
        assertEquals(3, entries.size());
        assertEquals("1", entries.get(0).get("userId"));
        assertEquals("ALICE", profileOf(entries.get(0)).get("name"));
        assertEquals("-" + BOB_CARD, entries.get(1).get("userId"));
        assertEquals("BOB", profileOf(entries.get(1)).get("name"));
        assertEquals("-E004010000000FFF", entries.get(2).get("userId"));
        assertEquals(false, entries.get(2).get("found"));
        assertFalse(entries.get(2).containsKey("profile"));
    }

    @Test
    void everyone_lists_local_users_first() throws Exception {
        HttpResponse<String> resp = get(PORT_A, "/profiles/iidx/25");
        assertEquals(200, resp.statusCode());

        List<Map<String, Object>> entries = array(resp.body());
        assertEquals(List.of("1", "-" + BOB_CARD), entries.stream().map(e -> e.get("userId")).toList());
        assertEquals(7, profileOf(entries.get(0)).get("pid"));
    }

    @Test
    void card_lookup_resolves_local_and_virtual_users() throws Exception {
        Map<String, Object> local = object(get(PORT_A, "/users/by-card/" + ALICE_CARD.toLowerCase()).body());
        assertEquals("1", local.get("userId"));
        assertEquals(false, local.get("virtual"));

        Map<String, Object> remote = object(get(PORT_A, "/users/by-card/" + BOB_CARD).body());
        assertEquals("-" + BOB_CARD, remote.get("userId"));
        assertEquals(true, remote.get("virtual"));
    }

    @Test
    void refid_lookup_round_trips() throws Exception {
        Map<String, Object> profile = profileOf(object(get(PORT_A, "/profiles/iidx/25/users/1").body()));
        String refId = (String) profile.get("refid");
        int extId = (Integer) profile.get("extid");

        assertEquals("1", object(get(PORT_A, "/users/by-refid/iidx/25/" + refId).body()).get("userId"));
        assertEquals("1", object(get(PORT_A, "/users/by-extid/iidx/25/" + extId).body()).get("userId"));
        assertEquals(404, get(PORT_A, "/users/by-extid/iidx/24/" + extId).statusCode());
    }

    // ---------- peer endpoint ----------

    @Test
    void peer_endpoint_wraps_profiles_with_cards_and_match() throws Exception {
        HttpResponse<String> resp = post(PORT_B, "/v1/peer/profiles", """
                { "game": "iidx", "version": 25, "idType": "card", "ids": ["%s"] }
                """.formatted(BOB_CARD.toLowerCase()));
        assertEquals(200, resp.statusCode());

        List<Map<String, Object>> records = array(resp.body());
        assertEquals(1, records.size());
        assertEquals("BOB", records.get(0).get("name"));
        assertEquals(List.of(BOB_CARD), records.get(0).get("cards"));
        assertEquals("exact", records.get(0).get("match"));
    }

    // ---------- failures ----------

    @Test
    void unreachable_only_peer_maps_to_502() throws Exception {
        HttpResponse<String> resp = get(PORT_C, "/profiles/iidx/25/users/-" + BOB_CARD);
        assertEquals(502, resp.statusCode());
        assertEquals("node-dead", object(resp.body()).get("peerId"));

        Map<String, Object> metrics = object(get(PORT_C, "/admin/federation/metrics").body());
        assertTrue(((Number) metrics.get("peerFailures")).longValue() >= 1);
    }

    @Test
    void local_reads_do_not_need_peers() throws Exception {
        HttpResponse<String> resp = post(PORT_C, "/profiles/iidx/25/lookup", """
                { "userIds": [] }
                """);
        assertEquals(200, resp.statusCode());
        assertEquals("[]", resp.body());
    }

    @Test
    void bad_input_maps_to_400() throws Exception {
        HttpResponse<String> badGame = get(PORT_A, "/profiles/gitadora/1/users/1");
        assertEquals(400, badGame.statusCode());

        HttpResponse<String> badVersion = get(PORT_A, "/profiles/iidx/abc/users/1");
        assertEquals(400, badVersion.statusCode());

        HttpResponse<String> badUser = get(PORT_A, "/profiles/iidx/25/users/0");
        assertEquals(400, badUser.statusCode());

        HttpResponse<String> badJson = post(PORT_A, "/profiles/iidx/25/lookup", "{ invalid-json");
        assertEquals(400, badJson.statusCode());
        assertTrue(badJson.body().contains("invalid JSON"));

        HttpResponse<String> badIdType = post(PORT_B, "/v1/peer/profiles", """
                { "game": "iidx", "version": 25, "idType": "friend", "ids": [] }
                """);
        assertEquals(400, badIdType.statusCode());
    }

    @Test
    void unknown_routes_and_methods() throws Exception {
        assertEquals(404, get(PORT_A, "/nope").statusCode());
        assertEquals(405, get(PORT_A, "/profiles/iidx/25/lookup").statusCode());
        assertEquals(405, post(PORT_A, "/users/by-card/X", "{}").statusCode());
        assertEquals(200, get(PORT_A, "/admin/health").statusCode());
    }
}
