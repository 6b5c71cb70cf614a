package org.hexarena.runtime.pathfinding;

import java.util.List;

import org.hexarena.runtime.model.HexCoordinate;

/**
 * Result of a minimum-moves-to-range search.
 *
 * @param movementDistance fewest moves after which at least one target is in range,
 *                         {@link PathfindingEngine#UNREACHABLE} if none is
 * @param reachableTargets every target in range at that distance, ascending by tile id
 */
public record RangedDistance(int movementDistance, List<HexCoordinate> reachableTargets) {

    public static final RangedDistance NONE = new RangedDistance(PathfindingEngine.UNREACHABLE, List.of());

    public boolean canReach() {
        return movementDistance != PathfindingEngine.UNREACHABLE;
    }
}
