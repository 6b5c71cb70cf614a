package org.hexarena.runtime.targeting;

/**
 * Closed set of target-selection strategies a skill can be configured with.
 */
public enum TargetingMethod {

    /** Fewest moves to bring the target into the caster's range, then the positional tie-break. */
    CLOSEST,

    /** Smallest raw hex distance, ignoring obstacles. */
    NEAREST,

    /** Largest raw hex distance, ignoring obstacles. */
    FURTHEST,

    /** The target team's unit closest to the opposing side. */
    FRONTMOST,

    /** The target team's unit furthest back on its own side. */
    REARMOST,

    /** The unit on the caster's mirror tile, else a spiral search around the mirror tile. */
    MIRROR,

    /** The nearest unit in the caster's diagonal row, else a ring scan by tile id. */
    ROW,

    /** The nearest unit in the caster's diagonal row, or nothing. */
    SAME_ROW,

    /** Rings of growing distance around the caster, each scanned by tile id. */
    RING,

    /** A unit on a tile adjacent to the caster and behind it. */
    BEHIND
}
