package org.hexarena.runtime.skill;

import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.UnitId;

/**
 * Key of one stored target. Single-target skills use slot 0; multi-target skills number their
 * targets 0..n-1.
 */
public record TargetSlotKey(UnitId unit, Team team, int slot) implements Comparable<TargetSlotKey> {

    @Override
    public int compareTo(TargetSlotKey other) {
        int cmp = unit.compareTo(other.unit);
        if (cmp != 0) return cmp;
        cmp = team.compareTo(other.team);
        return cmp != 0 ? cmp : Integer.compare(slot, other.slot);
    }
}
