package org.hexarena.runtime.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable value copy of everything a {@link SpatialGrid} owns. Two snapshots are equal exactly
 * when the grids they were taken from were in identical states, which makes them the natural
 * tool for checking rollback and swap identity.
 *
 * @param tiles          per-tile state, ascending by id
 * @param maxTeamSizes   capacity per team
 * @param teamUnits      placed units per team
 * @param companionLinks companions per owning unit
 */
public record GridSnapshot(
    List<TileSnapshot> tiles,
    Map<Team, Integer> maxTeamSizes,
    Map<Team, Set<UnitId>> teamUnits,
    Map<TeamUnit, Set<UnitId>> companionLinks
) {

    /**
     * State of one tile at snapshot time.
     */
    public record TileSnapshot(int id, TileState state, UnitId occupant, Team occupantTeam) {}
}
