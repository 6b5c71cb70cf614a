package org.hexarena.runtime.pathfinding;

import org.hexarena.runtime.model.HexCoordinate;

/**
 * Typed partition of an {@link IPathfindingCache}. Each region holds one kind of value and carries
 * its class, so a lookup in a region is checked against that type instead of trusted.
 *
 * @param <T> value type stored in the region
 */
public final class CacheRegion<T> {

    /** Shortest paths, start to goal inclusive; an empty array marks an unreachable goal. */
    public static final CacheRegion<HexCoordinate[]> PATHS =
        new CacheRegion<>("paths", HexCoordinate[].class, false);
    public static final CacheRegion<EffectiveDistance> EFFECTIVE_DISTANCES =
        new CacheRegion<>("effective-distances", EffectiveDistance.class, false);
    public static final CacheRegion<RangedDistance> RANGED_DISTANCES =
        new CacheRegion<>("ranged-distances", RangedDistance.class, false);

    private final String name;
    private final Class<T> valueType;
    private final boolean wholeBoard;

    /**
     * @param name       region name used in log output
     * @param valueType  class of the values stored in the region
     * @param wholeBoard {@code true} for regions whose values cover the whole board; these get
     *                   the smaller whole-board capacity
     */
    public CacheRegion(String name, Class<T> valueType, boolean wholeBoard) {
        this.name = name;
        this.valueType = valueType;
        this.wholeBoard = wholeBoard;
    }

    public String getName() {
        return name;
    }

    public boolean isWholeBoard() {
        return wholeBoard;
    }

    /**
     * @throws ClassCastException if the value does not belong in this region
     */
    public T cast(Object value) {
        return valueType.cast(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
