package org.hexarena.runtime.targeting;

import org.hexarena.runtime.model.Team;

/**
 * Order in which a ring scan visits the tiles of one ring, seen from the caster's side.
 */
public enum ScanDirection {

    /** Tiles nearer the opposing side first. */
    FRONTMOST,

    /** Tiles nearer the caster's own back line first. */
    REARMOST;

    /**
     * ALLY units stand on the low ids, so an ALLY caster scanning rearmost visits ascending ids.
     *
     * @return whether tile ids are visited in ascending order for a caster of {@code casterTeam}
     */
    public boolean ascendingFor(Team casterTeam) {
        return (casterTeam == Team.ALLY) == (this == REARMOST);
    }
}
