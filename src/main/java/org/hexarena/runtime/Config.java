package org.hexarena.runtime;

/**
 * Engine-wide constants.
 * <p>
 * Values that operators may tune live in {@code reference.conf}; the constants here are
 * the built-in defaults and the limits the engine never exceeds.
 */
public final class Config {

    private Config() {}

    // ==================== Grid ====================

    /** Team capacity of a fresh grid. */
    public static final int DEFAULT_MAX_TEAM_SIZE = 5;

    /** Multiplier separating the sequence number from the main unit id in encoded companion ids. */
    public static final int COMPANION_ID_OFFSET = 10000;

    // ==================== Pathfinding ====================

    /** A* gives up once more nodes than this have been discovered. */
    public static final int MAX_NODES_EXPLORED = 1000;

    /** Ring-by-ring search depth after which targets count as unreachable. */
    public static final int MAX_MOVEMENT_DISTANCE = 20;

    /** Entries kept for cached paths and distances. */
    public static final int PATH_CACHE_SIZE = 500;

    /** Entries kept for cached whole-board target maps. */
    public static final int TARGET_MAP_CACHE_SIZE = 100;

    /** Attack range assumed for units missing from the catalog. */
    public static final int DEFAULT_UNIT_RANGE = 1;
}
