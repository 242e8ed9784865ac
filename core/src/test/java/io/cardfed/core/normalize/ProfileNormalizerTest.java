package io.cardfed.core.normalize;

import io.cardfed.core.CanonicalProfile;
import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProfileNormalizerTest {

    private final ProfileNormalizer normalizer = new ProfileNormalizer();

    @Test
    void fixed_fields_always_present_and_name_defaults_to_empty() {
        CanonicalProfile p = normalizer.normalize(RawProfile.empty(), Game.SDVX, 5, "AABBCCDD00112233", 12345678);

        assertEquals("", p.name());
        assertEquals(Game.SDVX, p.game());
        assertEquals(5, p.version());
        assertEquals("AABBCCDD00112233", p.refId());
        assertEquals(12345678, p.extId());
        assertTrue(p.extras().isEmpty());
    }

    @Test
    void ddr_copies_area_unless_sentinel() {
        CanonicalProfile with = normalizer.normalize(raw("name", "DANCER", "area", 13), Game.DDR, 17, "r", 1);
        assertEquals("DANCER", with.name());
        assertEquals(13, with.extra("area"));

        CanonicalProfile without = normalizer.normalize(raw("area", -1), Game.DDR, 17, "r", 1);
        assertFalse(without.extras().containsKey("area"));
    }

    @Test
    void iidx_maps_area_to_pid_and_omits_unset_qpro_parts() {
        Map<String, Object> qpro = new HashMap<>();
        qpro.put("head", -1);
        qpro.put("hair", 3);
        CanonicalProfile p = normalizer.normalize(raw("area", 47, "qpro", qpro), Game.IIDX, 25, "r", 1);

        assertEquals(47, p.extra("pid"));
        assertEquals(Map.of("hair", 3), p.extra("qpro"));
    }

    @Test
    void iidx_without_qpro_emits_empty_qpro() {
        CanonicalProfile p = normalizer.normalize(raw("qpro", "garbage"), Game.IIDX, 25, "r", 1);
        assertEquals(Map.of(), p.extra("qpro"));
        assertFalse(p.extras().containsKey("pid"));
    }

    @Test
    void popn_and_reflec_extras() {
        CanonicalProfile popn = normalizer.normalize(raw("character", 1500), Game.POPN_MUSIC, 24, "r", 1);
        assertEquals(Map.of("chara", 1500), popn.extras());

        CanonicalProfile reflec = normalizer.normalize(raw("icon", 8), Game.REFLEC_BEAT, 6, "r", 1);
        assertEquals(Map.of("config", Map.of("icon_id", 8)), reflec.extras());

        CanonicalProfile noIcon = normalizer.normalize(raw("icon", -1), Game.REFLEC_BEAT, 6, "r", 1);
        assertTrue(noIcon.extras().isEmpty());
    }

    @Test
    void other_games_pass_through_core_fields_only() {
        CanonicalProfile p = normalizer.normalize(raw("name", "J", "area", 3, "icon", 2), Game.JUBEAT, 13, "r", 1);
        assertEquals("J", p.name());
        assertTrue(p.extras().isEmpty());
    }

    @Test
    void normalizing_twice_yields_equal_but_independent_values() {
        RawProfile r = raw("name", "A", "area", 2, "qpro", Map.of("face", 4));
        CanonicalProfile a = normalizer.normalize(r, Game.IIDX, 25, "r", 9);
        CanonicalProfile b = normalizer.normalize(r, Game.IIDX, 25, "r", 9);

        assertEquals(a, b);
        assertNotSame(a, b);
        assertNotSame(a.extras(), b.extras());

        Map<String, Object> view = a.toMap();
        view.put("name", "mutated");
        assertEquals("A", a.name());
        assertNotSame(view, a.toMap());
    }

    @Test
    void new_game_rule_is_one_table_entry() {
        ProfileNormalizer extended = normalizer.withExtractor(Game.SDVX, raw -> Map.of("appeal", 1));
        assertEquals(Map.of("appeal", 1), extended.normalize(RawProfile.empty(), Game.SDVX, 6, "r", 1).extras());
        assertTrue(normalizer.normalize(RawProfile.empty(), Game.SDVX, 6, "r", 1).extras().isEmpty());
    }

    @Test
    void to_map_flattens_fixed_fields_and_extras() {
        CanonicalProfile p = normalizer.normalize(raw("name", "N", "area", 5), Game.DDR, 17, "REF", 77);
        Map<String, Object> m = p.toMap();
        assertEquals("N", m.get("name"));
        assertEquals("ddr", m.get("game"));
        assertEquals(17, m.get("version"));
        assertEquals("REF", m.get("refid"));
        assertEquals(77, m.get("extid"));
        assertEquals(5, m.get("area"));
    }

    private static RawProfile raw(Object... kv) {
        Map<String, Object> m = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return new RawProfile(m);
    }
}
