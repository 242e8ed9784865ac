package io.cardfed.server.dto;

import java.util.List;

public class JsonFederationConfig {
    public String localServerId;
    public String peerFailurePolicy;
    public List<JsonPeer> peers;

    public static class JsonPeer {
        public String peerId;
        public String baseUrl;
        public long timeoutMillis;
    }
}
