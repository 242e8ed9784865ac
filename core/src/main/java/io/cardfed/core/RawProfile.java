// file: core/src/main/java/io/cardfed/core/RawProfile.java
package io.cardfed.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Untyped profile payload, as returned by a peer or stored locally.
 * <p>
 * This is the parse boundary for the loosely-typed wire format:
 *  - the backing map is deep-copied and unmodifiable, so instances can be shared
 *    between threads and between several normalizations,
 *  - {@link #optionalInt(String)} folds "absent", "not an integer" and the
 *    legacy sentinel -1 into an empty OptionalInt,
 *  - {@link #cards()} and {@link #match()} read the federation envelope fields.
 */
public final class RawProfile {

    public static final String CARDS = "cards";
    public static final String MATCH = "match";

    /** Legacy "unset" value used by game clients for integer fields. */
    public static final int ABSENT_SENTINEL = -1;

    private static final RawProfile EMPTY = new RawProfile(Map.of());

    private final Map<String, Object> fields;

    public RawProfile(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        this.fields = deepFreeze(fields);
    }

    public static RawProfile empty() {
        return EMPTY;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public Optional<String> string(String key) {
        Object v = fields.get(key);
        return v instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Integer field, or empty when missing, not integral, out of int range, or -1.
     */
    public OptionalInt optionalInt(String key) {
        Object v = fields.get(key);
        long n;
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            n = ((Number) v).longValue();
        } else if (v instanceof BigInteger big && big.bitLength() < 32) {
            n = big.longValue();
        } else {
            return OptionalInt.empty();
        }
        if (n < Integer.MIN_VALUE || n > Integer.MAX_VALUE || n == ABSENT_SENTINEL) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) n);
    }

    /** Nested record under {@code key}; empty record when missing or not an object. */
    @SuppressWarnings("unchecked")
    public RawProfile child(String key) {
        Object v = fields.get(key);
        if (v instanceof Map<?, ?> m) {
            return new RawProfile((Map<String, ?>) m);
        }
        return EMPTY;
    }

    /**
     * Card ids listed in the {@code cards} field, canonicalized.
     * Non-string and blank entries are ignored.
     */
    public List<CardId> cards() {
        Object v = fields.get(CARDS);
        if (!(v instanceof List<?> list)) {
            return List.of();
        }
        List<CardId> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o instanceof String s && !s.isBlank()) {
                out.add(CardId.of(s));
            }
        }
        return out;
    }

    public MatchQuality match() {
        return MatchQuality.fromWire(fields.get(MATCH));
    }

    /** Copy of this record without the given top-level keys. */
    public RawProfile without(String... keys) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        for (String k : keys) {
            copy.remove(k);
        }
        return new RawProfile(copy);
    }

    /** Copy of this record with one top-level key set. */
    public RawProfile with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(key, value);
        return new RawProfile(copy);
    }

    /** Fresh, mutable deep copy, e.g. for serialization. */
    public Map<String, Object> toMutableMap() {
        return deepThaw(fields);
    }

    public Set<String> keys() {
        return fields.keySet();
    }

    // ---------- deep copy helpers ----------

    static Map<String, Object> deepFreeze(Map<String, ?> in) {
        Map<String, Object> out = new LinkedHashMap<>(in.size());
        for (Map.Entry<String, ?> e : in.entrySet()) {
            out.put(e.getKey(), freezeValue(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object v) {
        if (v instanceof Map<?, ?> m) {
            return deepFreeze((Map<String, ?>) m);
        }
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(freezeValue(o));
            return Collections.unmodifiableList(out);
        }
        return v;
    }

    static Map<String, Object> deepThaw(Map<String, ?> in) {
        Map<String, Object> out = new LinkedHashMap<>(in.size());
        for (Map.Entry<String, ?> e : in.entrySet()) {
            out.put(e.getKey(), thawValue(e.getValue()));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object thawValue(Object v) {
        if (v instanceof Map<?, ?> m) {
            return deepThaw((Map<String, ?>) m);
        }
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(thawValue(o));
            return out;
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawProfile other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "RawProfile" + fields;
    }
}
