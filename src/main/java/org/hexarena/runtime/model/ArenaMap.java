package org.hexarena.runtime.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Initial tile states of an arena, keyed by board-position id. Tiles not listed start as
 * {@link TileState#DEFAULT}.
 * <p>
 * Configuration shape (one entry under {@code hexarena.arenas}):
 * <pre>
 * arena-1 {
 *   name = "Arena I"
 *   ally = [1, 2, 3]
 *   enemy = [43, 44, 45]
 *   blocked = []
 *   breakable = []
 * }
 * </pre>
 */
public final class ArenaMap {

    private final String key;
    private final String name;
    private final IntList ally;
    private final IntList enemy;
    private final IntList blocked;
    private final IntList breakable;

    public ArenaMap(String key, String name, IntList ally, IntList enemy, IntList blocked, IntList breakable) {
        this.key = key;
        this.name = name;
        this.ally = new IntArrayList(ally);
        this.enemy = new IntArrayList(enemy);
        this.blocked = new IntArrayList(blocked);
        this.breakable = new IntArrayList(breakable);
    }

    /**
     * Convenience factory for arenas without breakable obstacles.
     */
    public static ArenaMap of(String key, int[] ally, int[] enemy, int[] blocked) {
        return new ArenaMap(key, key, IntArrayList.wrap(ally), IntArrayList.wrap(enemy),
            IntArrayList.wrap(blocked), new IntArrayList());
    }

    /**
     * Reads an arena from its configuration block.
     *
     * @param key    the arena key (the block's path under {@code hexarena.arenas})
     * @param config the arena block
     */
    public static ArenaMap fromConfig(String key, com.typesafe.config.Config config) {
        String name = config.hasPath("name") ? config.getString("name") : key;
        return new ArenaMap(key, name,
            readIds(config, "ally"),
            readIds(config, "enemy"),
            readIds(config, "blocked"),
            readIds(config, "breakable"));
    }

    private static IntList readIds(com.typesafe.config.Config config, String path) {
        IntList ids = new IntArrayList();
        if (config.hasPath(path)) {
            config.getIntList(path).forEach(ids::add);
        }
        return ids;
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    /**
     * Applies this arena's states to a fresh set of tile states.
     *
     * @param layout the board the arena is laid on
     * @return tile states indexed by tile id (index 0 unused when ids start at 1)
     * @throws TileNotFoundException if the arena references a tile that is not on the board
     */
    TileState[] statesFor(BoardLayout layout) {
        int maxId = 0;
        for (int id : layout.tileIds()) {
            maxId = Math.max(maxId, id);
        }
        TileState[] states = new TileState[maxId + 1];
        for (int id : layout.tileIds()) {
            states[id] = TileState.DEFAULT;
        }
        apply(layout, states, ally, TileState.AVAILABLE_ALLY);
        apply(layout, states, enemy, TileState.AVAILABLE_ENEMY);
        apply(layout, states, blocked, TileState.BLOCKED);
        apply(layout, states, breakable, TileState.BLOCKED_BREAKABLE);
        return states;
    }

    private static void apply(BoardLayout layout, TileState[] states, IntList ids, TileState state) {
        for (int i = 0; i < ids.size(); i++) {
            int id = ids.getInt(i);
            if (!layout.contains(id)) {
                throw new TileNotFoundException(id);
            }
            states[id] = state;
        }
    }

    @Override
    public String toString() {
        return "ArenaMap[" + key + ", " + name + "]";
    }
}
