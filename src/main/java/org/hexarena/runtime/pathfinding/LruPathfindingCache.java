package org.hexarena.runtime.pathfinding;

import java.util.HashMap;
import java.util.Map;

import org.hexarena.runtime.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU cache with one partition per {@link CacheRegion}.
 * <p>
 * Regions holding per-query results (paths, distances) share the path capacity; regions holding
 * whole-board results get the smaller target-map capacity. Values are stored untyped and checked
 * against their region's value type on the way out.
 */
public class LruPathfindingCache implements IPathfindingCache {

    private static final Logger LOG = LoggerFactory.getLogger(LruPathfindingCache.class);

    private final int pathCapacity;
    private final int targetMapCapacity;
    private final Map<CacheRegion<?>, LruCache<String, Object>> regions = new HashMap<>();
    private long hits;
    private long misses;

    public LruPathfindingCache() {
        this(Config.PATH_CACHE_SIZE, Config.TARGET_MAP_CACHE_SIZE);
    }

    public LruPathfindingCache(int pathCapacity, int targetMapCapacity) {
        this.pathCapacity = pathCapacity;
        this.targetMapCapacity = targetMapCapacity;
    }

    /**
     * Creates a cache sized from the {@code hexarena.pathfinding} configuration block.
     */
    public static LruPathfindingCache fromConfig(com.typesafe.config.Config config) {
        int paths = config.hasPath("path-cache-size") ? config.getInt("path-cache-size") : Config.PATH_CACHE_SIZE;
        int maps = config.hasPath("target-map-cache-size") ? config.getInt("target-map-cache-size") : Config.TARGET_MAP_CACHE_SIZE;
        return new LruPathfindingCache(paths, maps);
    }

    @Override
    public <T> T get(CacheRegion<T> region, String key) {
        LruCache<String, Object> entries = regions.get(region);
        Object value = entries == null ? null : entries.get(key);
        if (value == null) {
            misses++;
            return null;
        }
        hits++;
        return region.cast(value);
    }

    @Override
    public <T> void put(CacheRegion<T> region, String key, T value) {
        regions.computeIfAbsent(region, r -> new LruCache<>(r.isWholeBoard() ? targetMapCapacity : pathCapacity))
            .put(key, value);
    }

    @Override
    public void invalidate() {
        if (LOG.isTraceEnabled()) {
            LOG.trace("Invalidating {} cached entries (hits={}, misses={})", size(), hits, misses);
        }
        regions.clear();
    }

    @Override
    public int size() {
        int total = 0;
        for (LruCache<String, Object> entries : regions.values()) {
            total += entries.size();
        }
        return total;
    }

    public long getHitCount() {
        return hits;
    }

    public long getMissCount() {
        return misses;
    }
}
