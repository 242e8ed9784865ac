// file: server/src/main/java/io/cardfed/server/dto/PeerQueryRequest.java
package io.cardfed.server.dto;

import java.util.List;

/**
 * JSON body for POST /v1/peer/profiles.
 * Example:
 *   {
 *     "game": "iidx",
 *     "version": 25,
 *     "idType": "card",
 *     "ids": ["E004010000000001"]
 *   }
 * The response is a JSON array of raw profile objects, each with "cards" and "match".
 */
public class PeerQueryRequest {
    public String game;
    public int version;
    public String idType;   // "card" | "server"
    public List<String> ids; // card ids; empty for "server"
}
