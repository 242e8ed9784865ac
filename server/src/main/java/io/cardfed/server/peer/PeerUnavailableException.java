package io.cardfed.server.peer;

/**
 * A peer call failed or timed out.
 */
public class PeerUnavailableException extends RuntimeException {

    private final String peerId;

    public PeerUnavailableException(String peerId, String message) {
        super(message);
        this.peerId = peerId;
    }

    public PeerUnavailableException(String peerId, String message, Throwable cause) {
        super(message, cause);
        this.peerId = peerId;
    }

    public String peerId() {
        return peerId;
    }
}
