// file: core/src/main/java/io/cardfed/core/RemoteUsers.java
package io.cardfed.core;

/**
 * Derivation between card ids and virtual user ids.
 * <p>
 * Virtual ids are a pure function of the card id: nothing is allocated or stored,
 * and the same card always yields the same id. The mapping is injective because the
 * card's canonical string is embedded verbatim.
 */
public final class RemoteUsers {

    private RemoteUsers() {
        // utility
    }

    public static UserId cardToUserId(CardId card) {
        return UserId.virtual(card);
    }

    /**
     * Inverse of {@link #cardToUserId(CardId)}.
     *
     * @throws InvariantViolationException if {@code userId} is a local id
     */
    public static CardId userIdToCard(UserId userId) {
        if (!userId.isVirtual()) {
            throw new InvariantViolationException(
                    "userIdToCard called on local user id " + userId);
        }
        return CardId.of(userId.value().substring(1));
    }

    public static boolean isRemote(UserId userId) {
        return userId.isVirtual();
    }
}
