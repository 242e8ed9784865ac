// file: core/src/main/java/io/cardfed/core/CardId.java
package io.cardfed.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Physical card identifier.
 * <p>
 * Card ids are case-insensitive on the wire. The canonical form is the upper-cased
 * input, nothing else is rewritten, so two CardIds compare equal exactly when
 * their canonical strings do.
 */
public record CardId(String value) implements Comparable<CardId> {

    public CardId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("card id must not be blank");
        value = value.toUpperCase(Locale.ROOT);
    }

    public static CardId of(String raw) {
        return new CardId(raw);
    }

    @Override
    public int compareTo(CardId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
