package org.hexarena.runtime.targeting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.hexarena.runtime.model.UnitId;

/**
 * A resolved target. Purely derived from the board and recomputed whenever the board changes.
 *
 * @param targetTileId tile the target stands on
 * @param targetUnit   the targeted unit
 * @param metadata     strategy-specific details for renderers and debugging (read-only)
 */
public record TargetInfo(int targetTileId, UnitId targetUnit, Map<String, Object> metadata) {

    public static final String SOURCE_TILE = "sourceTileId";
    public static final String MOVEMENT_DISTANCE = "movementDistance";
    public static final String DISTANCE = "distance";
    public static final String MIRROR_TILE = "mirrorTileId";
    public static final String MIRROR_HIT = "mirrorHit";
    public static final String EXAMINED_TILES = "examinedTiles";

    public TargetInfo {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public TargetInfo(int targetTileId, UnitId targetUnit) {
        this(targetTileId, targetUnit, Map.of());
    }

    /**
     * @return a copy with one more metadata entry
     */
    public TargetInfo with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new TargetInfo(targetTileId, targetUnit, copy);
    }
}
