// file: core/src/main/java/io/cardfed/core/UserId.java
package io.cardfed.core;

import java.util.Objects;

/**
 * Opaque player identity.
 * <p>
 * Two kinds share this type:
 *  - local:   a positive decimal id owned by the local store ("42"),
 *  - virtual: derived from a single card id, written as '-' + card ("-E004010000000001").
 * <p>
 * A local representation never starts with '-', so the two spaces cannot collide.
 * Use {@link RemoteUsers} to derive and invert virtual ids.
 */
public final class UserId {

    static final char VIRTUAL_PREFIX = '-';

    private final String value;

    private UserId(String value) {
        this.value = value;
    }

    public static UserId local(long id) {
        if (id <= 0) throw new IllegalArgumentException("local user id must be > 0, got " + id);
        return new UserId(Long.toString(id));
    }

    static UserId virtual(CardId card) {
        return new UserId(VIRTUAL_PREFIX + card.value());
    }

    /**
     * Parse the external representation produced by {@link #value()}.
     *
     * @throws IllegalArgumentException if the string is neither a positive decimal
     *                                  nor a '-'-prefixed card id
     */
    public static UserId parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String s = raw.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("user id must not be blank");
        if (s.charAt(0) == VIRTUAL_PREFIX) {
            return virtual(CardId.of(s.substring(1)));
        }
        try {
            return local(Long.parseLong(s));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid user id: " + raw, e);
        }
    }

    public String value() {
        return value;
    }

    boolean isVirtual() {
        return value.charAt(0) == VIRTUAL_PREFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserId other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
