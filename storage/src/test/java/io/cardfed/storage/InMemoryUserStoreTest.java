package io.cardfed.storage;

import io.cardfed.core.CanonicalProfile;
import io.cardfed.core.CardId;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import io.cardfed.core.RemoteUsers;
import io.cardfed.core.UserId;
import io.cardfed.core.normalize.ProfileNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryUserStoreTest {

    private final InMemoryUserStore store = new InMemoryUserStore(new ProfileNormalizer(), new Random(42));

    @Test
    void ref_and_ext_ids_are_stable_and_reversible() {
        UserId alice = store.createUser(CardId.of("A1"));
        String ref = store.getRefId(Game.IIDX, 25, alice);
        int ext = store.getExtId(Game.IIDX, 25, alice);

        assertEquals(ref, store.getRefId(Game.IIDX, 25, alice));
        assertEquals(ext, store.getExtId(Game.IIDX, 25, alice));
        assertEquals(16, ref.length());
        assertTrue(ext >= 10_000_000 && ext < 100_000_000);

        assertEquals(alice, store.fromRefId(Game.IIDX, 25, ref).orElseThrow());
        assertEquals(alice, store.fromExtId(Game.IIDX, 25, ext).orElseThrow());
        assertTrue(store.fromRefId(Game.IIDX, 26, ref).isEmpty());
    }

    @Test
    void ids_are_minted_for_virtual_users_too() {
        UserId virtual = RemoteUsers.cardToUserId(CardId.of("B2"));
        String ref = store.getRefId(Game.DDR, 17, virtual);
        assertEquals(virtual, store.fromRefId(Game.DDR, 17, ref).orElseThrow());
    }

    @Test
    void any_profile_falls_back_to_newest_other_version() {
        UserId u = store.createUser(CardId.of("A1"));
        store.putProfile(Game.DDR, 15, u, new RawProfile(Map.of("name", "OLD")));
        store.putProfile(Game.DDR, 16, u, new RawProfile(Map.of("name", "NEWER", "area", 4)));

        assertTrue(store.getProfile(Game.DDR, 17, u).isEmpty());
        CanonicalProfile any = store.getAnyProfile(Game.DDR, 17, u).orElseThrow();
        assertEquals("NEWER", any.name());
        assertEquals(16, any.version());
        assertEquals(4, any.extra("area"));
        assertEquals(store.getRefId(Game.DDR, 16, u), any.refId());
    }

    @Test
    void any_profiles_keeps_input_order_and_reports_missing() {
        UserId a = store.createUser(CardId.of("A1"));
        UserId b = store.createUser(CardId.of("B1"));
        store.putProfile(Game.SDVX, 6, b, new RawProfile(Map.of("name", "B")));

        List<UserStore.UserProfile> got = store.getAnyProfiles(Game.SDVX, 6, List.of(b, a));
        assertEquals(List.of(b, a), got.stream().map(UserStore.UserProfile::userId).toList());
        assertTrue(got.get(0).found());
        assertFalse(got.get(1).found());
    }

    @Test
    void cards_and_profiles_enumerate_in_insertion_order() {
        UserId a = store.createUser(CardId.of("A1"));
        store.addCard(a, CardId.of("a2"));
        UserId b = store.createUser(CardId.of("B1"));
        store.putProfile(Game.JUBEAT, 13, b, RawProfile.empty());
        store.putProfile(Game.JUBEAT, 13, a, RawProfile.empty());

        assertEquals(List.of(
                new UserStore.CardBinding(CardId.of("A1"), a),
                new UserStore.CardBinding(CardId.of("A2"), a),
                new UserStore.CardBinding(CardId.of("B1"), b)
        ), store.getAllCards());
        assertEquals(List.of(CardId.of("A1"), CardId.of("A2")), store.getCards(a));
        assertEquals(List.of(b, a), store.getAllProfiles(Game.JUBEAT, 13).stream()
                .map(UserStore.UserProfile::userId).toList());
        assertEquals(a, store.fromCardId(CardId.of("a2")).orElseThrow());
    }

    @Test
    void writes_reject_virtual_unknown_and_duplicate() {
        store.createUser(CardId.of("A1"));
        assertThrows(IllegalArgumentException.class, () -> store.createUser(CardId.of("a1")));
        assertThrows(IllegalArgumentException.class,
                () -> store.putProfile(Game.DDR, 1, RemoteUsers.cardToUserId(CardId.of("Z")), RawProfile.empty()));
        assertThrows(IllegalArgumentException.class,
                () -> store.putProfile(Game.DDR, 1, UserId.local(999), RawProfile.empty()));
    }
}
