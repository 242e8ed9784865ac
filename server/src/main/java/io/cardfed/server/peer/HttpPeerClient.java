// file: server/src/main/java/io/cardfed/server/peer/HttpPeerClient.java
package io.cardfed.server.peer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.server.dto.PeerQueryRequest;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP-based PeerClient.
 *
 * Talks to a remote node's peer endpoint:
 *
 *   POST /v1/peer/profiles
 *   { "game": "iidx", "version": 25, "idType": "card", "ids": ["E004..."] }
 *
 * Response JSON is an array of raw profile objects:
 *
 *   [ { "name": "ALICE", "area": 13, "cards": ["E004..."], "match": "exact" } ]
 *
 * The request timeout is the only timeout applied to a peer call; the fan-out
 * layer above does not add its own.
 */
public final class HttpPeerClient implements PeerClient {

    static final String PEER_PATH = "/v1/peer/profiles";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {};

    private final String peerId;
    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient client;

    public HttpPeerClient(String peerId, URI baseUri, Duration timeout) {
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public String peerId() {
        return peerId;
    }

    @Override
    public List<RawProfile> getProfiles(Game game, int version, IdType idType, List<CardId> ids) {
        PeerQueryRequest body = new PeerQueryRequest();
        body.game = game.tag();
        body.version = version;
        body.idType = idType.wire();
        body.ids = idType == IdType.CARD
                ? ids.stream().map(CardId::value).toList()
                : List.of();

        try {
            HttpRequest req = HttpRequest.newBuilder(baseUri.resolve(PEER_PATH))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(body)))
                    .build();

            HttpResponse<byte[]> resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw new PeerUnavailableException(peerId,
                        "peer " + peerId + " returned HTTP " + resp.statusCode()
                                + " for " + game.tag() + "/" + version);
            }

            List<Map<String, Object>> records = MAPPER.readValue(resp.body(), RECORDS);
            List<RawProfile> out = new ArrayList<>(records.size());
            for (Map<String, Object> r : records) {
                if (r != null) out.add(new RawProfile(r));
            }
            return out;
        } catch (IOException e) {
            throw new PeerUnavailableException(peerId,
                    "failed to query peer " + peerId + " at " + baseUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PeerUnavailableException(peerId,
                    "interrupted while querying peer " + peerId, e);
        }
    }
}
