package io.cardfed.core;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RemoteUsersTest {

    @Test
    void derivation_is_deterministic_and_case_insensitive() {
        UserId a = RemoteUsers.cardToUserId(CardId.of("e004010000000001"));
        UserId b = RemoteUsers.cardToUserId(CardId.of("E004010000000001"));
        assertEquals(a, b);
        assertTrue(RemoteUsers.isRemote(a));
    }

    @Test
    void only_case_is_canonicalized() {
        UserId padded = RemoteUsers.cardToUserId(CardId.of(" a1"));
        UserId plain = RemoteUsers.cardToUserId(CardId.of("A1"));

        assertNotEquals(plain, padded);
        assertEquals(" A1", RemoteUsers.userIdToCard(padded).value());
        assertThrows(IllegalArgumentException.class, () -> CardId.of("  "));
    }

    @Test
    void derivation_is_injective_over_many_cards() {
        Set<UserId> seen = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            CardId card = CardId.of(String.format("E0040100%08X", i));
            assertTrue(seen.add(RemoteUsers.cardToUserId(card)), "collision at " + card);
        }
    }

    @Test
    void round_trip_through_card_is_stable() {
        UserId v = RemoteUsers.cardToUserId(CardId.of("012E0000ABCDEF01"));
        CardId back = RemoteUsers.userIdToCard(v);
        assertEquals("012E0000ABCDEF01", back.value());
        assertEquals(v, RemoteUsers.cardToUserId(back));
    }

    @Test
    void local_ids_are_never_remote_and_cannot_be_inverted() {
        UserId local = UserId.local(42);
        assertFalse(RemoteUsers.isRemote(local));
        assertThrows(InvariantViolationException.class, () -> RemoteUsers.userIdToCard(local));
    }

    @Test
    void parse_accepts_both_representations() {
        assertEquals(UserId.local(7), UserId.parse("7"));
        UserId v = RemoteUsers.cardToUserId(CardId.of("ABCD"));
        assertEquals(v, UserId.parse(v.value()));
        assertEquals(v, UserId.parse("-abcd"));

        assertThrows(IllegalArgumentException.class, () -> UserId.parse("0"));
        assertThrows(IllegalArgumentException.class, () -> UserId.parse("abc"));
        assertThrows(IllegalArgumentException.class, () -> UserId.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> UserId.parse("-"));
    }
}
