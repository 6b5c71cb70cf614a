package org.hexarena.runtime.pathfinding;

import org.hexarena.runtime.model.HexCoordinate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LruPathfindingCacheTest {

    private static final HexCoordinate[] NO_TILES = new HexCoordinate[0];
    private static final CacheRegion<String> MAPS = new CacheRegion<>("maps", String.class, true);

    @Test
    void put_shouldEvictLeastRecentlyUsedPerRegion() {
        LruPathfindingCache cache = new LruPathfindingCache(2, 1);

        cache.put(CacheRegion.PATHS, "a", NO_TILES);
        cache.put(CacheRegion.PATHS, "b", NO_TILES);
        cache.get(CacheRegion.PATHS, "a");
        cache.put(CacheRegion.PATHS, "c", NO_TILES);

        assertThat(cache.get(CacheRegion.PATHS, "a")).isNotNull();
        assertThat(cache.get(CacheRegion.PATHS, "b")).isNull();
        assertThat(cache.get(CacheRegion.PATHS, "c")).isNotNull();
    }

    @Test
    void wholeBoardRegions_shouldUseSmallerCapacity() {
        LruPathfindingCache cache = new LruPathfindingCache(10, 1);

        cache.put(MAPS, "first", "x");
        cache.put(MAPS, "second", "y");

        assertThat(cache.get(MAPS, "first")).isNull();
        assertThat(cache.get(MAPS, "second")).isEqualTo("y");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void invalidate_shouldDropEveryRegion() {
        LruPathfindingCache cache = new LruPathfindingCache();
        cache.put(CacheRegion.PATHS, "k", NO_TILES);
        cache.put(CacheRegion.RANGED_DISTANCES, "k", RangedDistance.NONE);

        cache.invalidate();

        assertThat(cache.size()).isZero();
        assertThat(cache.get(CacheRegion.RANGED_DISTANCES, "k")).isNull();
        assertThat(cache.getMissCount()).isEqualTo(1);
    }

    @Test
    void get_shouldKeepRegionsWithTheSameNameApart() {
        CacheRegion<Integer> counts = new CacheRegion<>("maps", Integer.class, true);
        CacheRegion<String> names = new CacheRegion<>("maps", String.class, true);
        LruPathfindingCache cache = new LruPathfindingCache();
        cache.put(names, "k", "value");

        assertThat(cache.get(counts, "k")).isNull();
        assertThat(cache.get(names, "k")).isEqualTo("value");
    }
}
