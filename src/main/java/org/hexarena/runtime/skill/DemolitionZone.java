package org.hexarena.runtime.skill;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Tiles a demolition-zone skill paints for one team: {@code blocked} become Blocked, {@code breakable}
 * become Blocked-Breakable.
 */
public record DemolitionZone(IntList blocked, IntList breakable) {

    public DemolitionZone {
        blocked = IntLists.unmodifiable(new IntArrayList(blocked));
        breakable = IntLists.unmodifiable(new IntArrayList(breakable));
        for (int i = 0; i < breakable.size(); i++) {
            if (blocked.contains(breakable.getInt(i))) {
                throw new IllegalArgumentException("Tile " + breakable.getInt(i) + " is both blocked and breakable");
            }
        }
    }

    public static DemolitionZone fromConfig(com.typesafe.config.Config config) {
        return new DemolitionZone(
            new IntArrayList(config.getIntList("blocked")),
            config.hasPath("breakable") ? new IntArrayList(config.getIntList("breakable")) : new IntArrayList());
    }

    /**
     * @return blocked tiles followed by breakable tiles
     */
    public IntList tiles() {
        IntList all = new IntArrayList(blocked);
        all.addAll(breakable);
        return all;
    }

    public boolean contains(int tileId) {
        return blocked.contains(tileId) || breakable.contains(tileId);
    }

    public boolean isEmpty() {
        return blocked.isEmpty() && breakable.isEmpty();
    }
}
