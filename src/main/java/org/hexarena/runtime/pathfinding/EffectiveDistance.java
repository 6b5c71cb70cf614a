package org.hexarena.runtime.pathfinding;

/**
 * Moves a unit needs before a goal is within its range.
 *
 * @param movementDistance moves needed, {@link PathfindingEngine#UNREACHABLE} if no path exists
 * @param canReach         whether the goal can be brought into range at all
 * @param directDistance   raw hex distance, ignoring obstacles
 */
public record EffectiveDistance(int movementDistance, boolean canReach, int directDistance) {
}
