package org.hexarena.runtime.model;

/**
 * A unit as seen from one team. The same catalog unit may be fielded by both teams at once,
 * so per-unit bookkeeping (companion links, skill state) is keyed by this pair.
 */
public record TeamUnit(UnitId unit, Team team) {

    @Override
    public String toString() {
        return unit + "@" + team;
    }
}
