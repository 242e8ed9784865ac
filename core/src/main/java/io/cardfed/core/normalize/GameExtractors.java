// file: core/src/main/java/io/cardfed/core/normalize/GameExtractors.java
package io.cardfed.core.normalize;

import io.cardfed.core.Game;
import io.cardfed.core.RawProfile;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in per-game extraction rules.
 * <p>
 *  - DDR:         area -> area
 *  - IIDX:        area -> pid, qpro.{head,hair,face,body,hand} -> qpro.{...}
 *  - pop'n music: character -> chara
 *  - REFLEC BEAT: icon -> config.icon_id
 * <p>
 * Every other game has no extras.
 */
public final class GameExtractors {

    static final List<String> QPRO_PARTS = List.of("head", "hair", "face", "body", "hand");

    private GameExtractors() {
        // utility
    }

    public static Map<Game, GameFieldExtractor> defaults() {
        Map<Game, GameFieldExtractor> table = new EnumMap<>(Game.class);
        table.put(Game.DDR, GameExtractors::ddr);
        table.put(Game.IIDX, GameExtractors::iidx);
        table.put(Game.POPN_MUSIC, GameExtractors::popn);
        table.put(Game.REFLEC_BEAT, GameExtractors::reflec);
        return table;
    }

    static Map<String, Object> ddr(RawProfile raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.optionalInt("area").ifPresent(area -> out.put("area", area));
        return out;
    }

    static Map<String, Object> iidx(RawProfile raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.optionalInt("area").ifPresent(area -> out.put("pid", area));

        // Always emitted, possibly empty; parts are never defaulted.
        Map<String, Object> qpro = new LinkedHashMap<>();
        RawProfile src = raw.child("qpro");
        for (String part : QPRO_PARTS) {
            src.optionalInt(part).ifPresent(v -> qpro.put(part, v));
        }
        out.put("qpro", qpro);
        return out;
    }

    static Map<String, Object> popn(RawProfile raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.optionalInt("character").ifPresent(c -> out.put("chara", c));
        return out;
    }

    static Map<String, Object> reflec(RawProfile raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.optionalInt("icon").ifPresent(icon -> out.put("config", Map.of("icon_id", icon)));
        return out;
    }
}
