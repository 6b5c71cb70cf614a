package org.hexarena.runtime.pathfinding;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Access-ordered map that evicts its least recently used entry once it grows past its capacity.
 */
class LruCache<K, V> extends LinkedHashMap<K, V> {

    private final int capacity;

    LruCache(int capacity) {
        super(16, 0.75f, true);
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    int getCapacity() {
        return capacity;
    }

    @Override
    protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
        return size() > capacity;
    }
}
