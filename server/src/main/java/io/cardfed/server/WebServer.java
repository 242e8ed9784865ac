// file: server/src/main/java/io/cardfed/server/WebServer.java
package io.cardfed.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfed.core.CanonicalProfile;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.core.RemoteUsers;
import io.cardfed.core.UserId;
import io.cardfed.server.dto.LookupRequest;
import io.cardfed.server.dto.PeerQueryRequest;
import io.cardfed.server.dto.UserProfileResponse;
import io.cardfed.server.federation.FederationMetrics;
import io.cardfed.server.federation.ProfileReconciler;
import io.cardfed.server.peer.IdType;
import io.cardfed.server.peer.PeerProfileService;
import io.cardfed.server.peer.PeerUnavailableException;
import io.cardfed.storage.UserStore.UserProfile;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thin HTTP adapter over ProfileReconciler + PeerProfileService.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit basic per-request logging.
 *
 * Path layout (v1):
 *   - GET  /profiles/{game}/{version}/users/{userId}[?any=true]   single user
 *   - POST /profiles/{game}/{version}/lookup                      batch (any version)
 *   - GET  /profiles/{game}/{version}                             everyone
 *   - GET  /users/by-card/{card}
 *   - GET  /users/by-refid/{game}/{version}/{refId}
 *   - GET  /users/by-extid/{game}/{version}/{extId}
 *   - POST /v1/peer/profiles                                      answers other servers
 *   - GET  /admin/health
 *   - GET  /admin/federation/metrics
 *
 * Status mapping: bad input 400, oversized body 413, peer failure 502, other errors 500.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ProfileReconciler reconciler;
    private final PeerProfileService peerService;
    private final FederationMetrics metrics;

    public WebServer(int port,
                     ProfileReconciler reconciler,
                     PeerProfileService peerService,
                     FederationMetrics metrics) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.peerService = Objects.requireNonNull(peerService, "peerService");
        this.metrics = Objects.requireNonNull(metrics, "metrics");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::handle)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void handle(HttpServerExchange ex) {
        // Lookups block on the store and on peers; keep them off the IO threads.
        if (ex.isInIoThread()) {
            ex.dispatch(this::handle);
            return;
        }

        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        List<String> seg = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();

        if (seg.isEmpty()) {
            reject(ex, 404, "not found");
            return;
        }

        switch (seg.get(0)) {
            case "profiles" -> routeProfiles(ex, method, seg);
            case "users" -> routeUsers(ex, method, seg);
            case "v1" -> {
                if (seg.equals(List.of("v1", "peer", "profiles")) && "POST".equals(method)) {
                    withBody(ex, this::handlePeerQuery);
                } else {
                    reject(ex, 404, "not found");
                }
            }
            case "admin" -> {
                if (seg.equals(List.of("admin", "health"))) {
                    execute(ex, () -> new Reply(200, Map.of("status", "ok")));
                } else if (seg.equals(List.of("admin", "federation", "metrics"))) {
                    execute(ex, () -> new Reply(200, metrics.snapshot()));
                } else {
                    reject(ex, 404, "not found");
                }
            }
            default -> reject(ex, 404, "not found");
        }
    }

    private void routeProfiles(HttpServerExchange ex, String method, List<String> seg) {
        if (seg.size() == 3 && "GET".equals(method)) {
            execute(ex, () -> handleAll(seg.get(1), seg.get(2)));
        } else if (seg.size() == 4 && "lookup".equals(seg.get(3)) && "POST".equals(method)) {
            withBody(ex, data -> handleLookup(seg.get(1), seg.get(2), data));
        } else if (seg.size() == 5 && "users".equals(seg.get(3)) && "GET".equals(method)) {
            boolean any = "true".equalsIgnoreCase(firstOrNull(ex.getQueryParameters().get("any")));
            execute(ex, () -> handleOne(seg.get(1), seg.get(2), seg.get(4), any));
        } else if (seg.size() == 3
                || (seg.size() == 4 && "lookup".equals(seg.get(3)))
                || (seg.size() == 5 && "users".equals(seg.get(3)))) {
            reject(ex, 405, "method not allowed");
        } else {
            reject(ex, 404, "not found");
        }
    }

    private void routeUsers(HttpServerExchange ex, String method, List<String> seg) {
        if (!"GET".equals(method)) {
            reject(ex, 405, "method not allowed");
            return;
        }
        String kind = seg.size() > 1 ? seg.get(1) : "";
        switch (kind) {
            case "by-card" -> {
                if (seg.size() != 3) {
                    reject(ex, 400, "card must not be empty");
                } else {
                    execute(ex, () -> userReply(Optional.of(reconciler.fromCard(CardId.of(seg.get(2))))));
                }
            }
            case "by-refid" -> {
                if (seg.size() != 5) {
                    reject(ex, 400, "expected /users/by-refid/{game}/{version}/{refId}");
                } else {
                    execute(ex, () -> userReply(reconciler.fromRefId(
                            Game.fromTag(seg.get(2)), parseVersion(seg.get(3)), seg.get(4))));
                }
            }
            case "by-extid" -> {
                if (seg.size() != 5) {
                    reject(ex, 400, "expected /users/by-extid/{game}/{version}/{extId}");
                } else {
                    execute(ex, () -> userReply(reconciler.fromExtId(
                            Game.fromTag(seg.get(2)), parseVersion(seg.get(3)), parseInt("extId", seg.get(4)))));
                }
            }
            default -> reject(ex, 404, "not found");
        }
    }

    // ---------- handlers ----------

    /** GET /profiles/{game}/{version}/users/{userId} */
    private Reply handleOne(String gameTag, String versionStr, String userIdStr, boolean any) {
        Game game = Game.fromTag(gameTag);
        int version = parseVersion(versionStr);
        UserId userId = UserId.parse(userIdStr);

        Optional<CanonicalProfile> p = any
                ? reconciler.getAnyProfile(game, version, userId)
                : reconciler.getProfile(game, version, userId);
        if (p.isEmpty()) {
            return new Reply(404, Map.of("found", false));
        }
        return new Reply(200, toDto(new UserProfile(userId, p.get())));
    }

    /** POST /profiles/{game}/{version}/lookup */
    private Reply handleLookup(String gameTag, String versionStr, byte[] data) throws Exception {
        Game game = Game.fromTag(gameTag);
        int version = parseVersion(versionStr);
        LookupRequest req = json.readValue(data, LookupRequest.class);
        if (req.userIds == null) {
            throw new IllegalArgumentException("userIds must be present");
        }

        List<UserId> ids = new ArrayList<>(req.userIds.size());
        for (String s : req.userIds) {
            ids.add(UserId.parse(s));
        }
        return new Reply(200, toDtos(reconciler.getAnyProfiles(game, version, ids)));
    }

    /** GET /profiles/{game}/{version} */
    private Reply handleAll(String gameTag, String versionStr) {
        Game game = Game.fromTag(gameTag);
        int version = parseVersion(versionStr);
        return new Reply(200, toDtos(reconciler.getAllProfiles(game, version)));
    }

    /** POST /v1/peer/profiles */
    private Reply handlePeerQuery(byte[] data) throws Exception {
        PeerQueryRequest req = json.readValue(data, PeerQueryRequest.class);
        Game game = Game.fromTag(req.game);
        if (req.version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        IdType idType = IdType.fromWire(req.idType);

        List<CardId> cards = new ArrayList<>();
        if (req.ids != null) {
            for (String s : req.ids) {
                cards.add(CardId.of(s));
            }
        }

        List<Map<String, Object>> body = new ArrayList<>();
        for (RawProfile r : peerService.answer(game, req.version, idType, cards)) {
            body.add(r.toMutableMap());
        }
        return new Reply(200, body);
    }

    private static Reply userReply(Optional<UserId> userId) {
        if (userId.isEmpty()) {
            return new Reply(404, Map.of("found", false));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("found", true);
        body.put("userId", userId.get().value());
        body.put("virtual", RemoteUsers.isRemote(userId.get()));
        return new Reply(200, body);
    }

    // ---------- plumbing ----------

    private record Reply(int status, Object body) {}

    @FunctionalInterface
    private interface EngineCall {
        Reply run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyCall {
        Reply run(byte[] data) throws Exception;
    }

    /** Run an engine call, send its reply, map failures and log the request. */
    private void execute(HttpServerExchange ex, EngineCall call) {
        String method = ex.getRequestMethod().toString();
        long start = System.nanoTime();
        int status;
        long engineMs = -1L;
        Throwable error = null;
        try {
            long eStart = System.nanoTime();
            Reply r = call.run();
            engineMs = (System.nanoTime() - eStart) / 1_000_000L;
            status = r.status();
            send(ex, status, r.body());
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (PeerUnavailableException peerEx) {
            status = 502;
            error = peerEx;
            send(ex, status, Map.of(
                    "error", "peer unavailable",
                    "peerId", String.valueOf(peerEx.peerId()),
                    "message", String.valueOf(peerEx.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, ex.getRequestPath(), status, totalMs, engineMs, error);
    }

    private void withBody(HttpServerExchange ex, BodyCall call) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    if (data.length > MAX_BODY_BYTES) {
                        reject(exchange, 413, "request body too large");
                    } else if (exchange.isInIoThread()) {
                        exchange.dispatch(() -> execute(exchange, () -> call.run(data)));
                    } else {
                        execute(exchange, () -> call.run(data));
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(),
                            exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    private void reject(HttpServerExchange ex, int status, String message) {
        send(ex, status, Map.of("error", message));
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, 0, -1, null);
    }

    private static int parseVersion(String s) {
        int v = parseInt("version", s);
        if (v < 0) throw new IllegalArgumentException("version must be >= 0");
        return v;
    }

    private static int parseInt(String what, String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(what + " must be an integer", nfe);
        }
    }

    private static List<UserProfileResponse> toDtos(List<UserProfile> results) {
        List<UserProfileResponse> out = new ArrayList<>(results.size());
        for (UserProfile up : results) {
            out.add(toDto(up));
        }
        return out;
    }

    private static UserProfileResponse toDto(UserProfile up) {
        UserProfileResponse dto = new UserProfileResponse();
        dto.userId = up.userId().value();
        dto.found = up.found();
        dto.profile = up.found() ? up.profile().toMap() : null;
        return dto;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
