package org.hexarena.runtime.pathfinding;

/**
 * Cache that never stores anything. Every search runs from scratch.
 */
public class NoOpPathfindingCache implements IPathfindingCache {

    @Override
    public <T> T get(CacheRegion<T> region, String key) {
        return null;
    }

    @Override
    public <T> void put(CacheRegion<T> region, String key, T value) {
    }

    @Override
    public void invalidate() {
    }

    @Override
    public int size() {
        return 0;
    }
}
