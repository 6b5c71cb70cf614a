package org.hexarena.runtime.pathfinding;

/**
 * Cache seam for search results.
 * <p>
 * Keys always include the grid's modification count, so a stale entry can never be returned for
 * a changed board. Owners still call {@link #invalidate()} at the end of every mutating
 * transaction to release memory held by entries that can no longer be hit.
 * <p>
 * Implementations:
 * <ul>
 *   <li>{@link LruPathfindingCache} - bounded LRU per region (default)</li>
 *   <li>{@link NoOpPathfindingCache} - stores nothing, used to check search results without caching</li>
 * </ul>
 */
public interface IPathfindingCache {

    /**
     * @return the cached value, or {@code null} on a miss
     */
    <T> T get(CacheRegion<T> region, String key);

    <T> void put(CacheRegion<T> region, String key, T value);

    /**
     * Drops every entry in every region.
     */
    void invalidate();

    /**
     * @return the number of entries across all regions
     */
    int size();
}
