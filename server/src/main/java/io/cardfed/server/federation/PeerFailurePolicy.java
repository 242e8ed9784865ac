package io.cardfed.server.federation;

import java.util.Locale;

/**
 * What a fan-out does when a peer call fails.
 *  - DEGRADE: the failed peer contributes nothing; logged and counted. A fan-out
 *             whose only call failed still reports the failure.
 *  - FAIL:    any failed peer fails the whole operation.
 */
public enum PeerFailurePolicy {
    DEGRADE,
    FAIL;

    public static PeerFailurePolicy fromString(String s) {
        if (s == null || s.isBlank()) return DEGRADE;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "degrade" -> DEGRADE;
            case "fail" -> FAIL;
            default -> throw new IllegalArgumentException("peerFailurePolicy must be one of: degrade, fail");
        };
    }
}
