package org.hexarena.runtime.transaction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.hexarena.runtime.model.ArenaMap;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.Tile;
import org.hexarena.runtime.model.TileState;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.pathfinding.PathfindingEngine;
import org.hexarena.runtime.skill.SkillEngine;
import org.hexarena.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * The only write path for units on the board. Every operation runs as a transaction of
 * {@link TransactionStep}s: on the first failing step, all steps applied so far are rolled back in
 * reverse order and the operation returns {@code false}.
 * <p>
 * Transactions nest. An operation invoked from inside another joins the outer transaction: its
 * steps are journaled with the outer ones, so a later failure of the outer transaction undoes them
 * too. When the outermost transaction finishes, successfully or not, the pathfinding cache is
 * invalidated and active skills are updated, once.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe.
 */
public class TransactionCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final SpatialGrid grid;
    private final PathfindingEngine pathfinding;
    private final SkillEngine skills;
    private final IRandomProvider random;
    private final List<TransactionStep> journal = new ArrayList<>();
    private int depth;

    public TransactionCoordinator(SpatialGrid grid, PathfindingEngine pathfinding, SkillEngine skills, IRandomProvider random) {
        this.grid = grid;
        this.pathfinding = pathfinding;
        this.skills = skills;
        this.random = random;
    }

    public SpatialGrid getGrid() {
        return grid;
    }

    public SkillEngine getSkillEngine() {
        return skills;
    }

    // ==================== Transaction Core ====================

    /**
     * Runs the steps in order as one transaction.
     *
     * @return {@code true} if every step succeeded; {@code false} after rolling back
     */
    public boolean execute(List<TransactionStep> steps) {
        int mark = journal.size();
        depth++;
        try {
            for (TransactionStep step : steps) {
                boolean applied;
                try {
                    applied = step.apply().getAsBoolean();
                } catch (RuntimeException e) {
                    try {
                        rollbackTo(mark);
                    } catch (IllegalStateException rollbackFailure) {
                        e.addSuppressed(rollbackFailure);
                    }
                    throw e;
                }
                if (!applied) {
                    LOG.debug("Step '{}' failed, rolling back {} step(s)", step, journal.size() - mark);
                    rollbackTo(mark);
                    return false;
                }
                journal.add(step);
            }
            return true;
        } finally {
            depth--;
            if (depth == 0) {
                journal.clear();
                finish();
            }
        }
    }

    public boolean execute(TransactionStep... steps) {
        return execute(Arrays.asList(steps));
    }

    /**
     * Rolls back every step journaled after {@code mark}, newest first. A failing rollback does not
     * stop the others.
     *
     * @throws IllegalStateException after all steps were visited, if any of them failed to roll back
     */
    private void rollbackTo(int mark) {
        IllegalStateException failure = null;
        for (int i = journal.size() - 1; i >= mark; i--) {
            TransactionStep step = journal.remove(i);
            try {
                step.rollback().run();
            } catch (RuntimeException e) {
                LOG.error("Rollback of step '{}' failed", step, e);
                if (failure == null) {
                    failure = new IllegalStateException("Rollback of step '" + step + "' failed; the board may be inconsistent");
                }
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void finish() {
        pathfinding.invalidate();
        skills.update();
    }

    // ==================== Operations ====================

    /**
     * Places a main unit and activates its skill. An existing occupant of the tile is removed first,
     * with the same cascade as {@link #remove(int)}.
     * <p>
     * A unit whose skill claims tiles (see {@link SkillEngine#claimedTiles}) is never placed on one
     * of them: when {@code tileId} is claimed, the unit goes to a random free tile of its team
     * outside the claim instead.
     *
     * @return {@code false} for companions, rejected placements and failed skill activations
     */
    public boolean place(int tileId, UnitId unit, Team team) {
        if (unit.isCompanion()) {
            LOG.debug("Rejected direct placement of companion {}", unit);
            return false;
        }
        IntList claimed = skills.claimedTiles(unit, team);
        int target = tileId;
        if (claimed.contains(tileId)) {
            List<Tile> free = freeTilesOutside(team, claimed);
            if (free.isEmpty()) {
                LOG.debug("Rejected placement of {} on claimed tile {}: no free tile outside the claim", unit, tileId);
                return false;
            }
            target = free.get(random.nextInt(free.size())).getId();
            LOG.debug("Redirecting {} from claimed tile {} to tile {}", unit, tileId, target);
        }
        Tile tile = grid.getTileById(target);
        int destination = target;
        List<TransactionStep> steps = new ArrayList<>();
        steps.add(TransactionStep.of("clear tile " + destination, () -> !tile.isOccupied() || remove(destination)));
        steps.add(placeStep(destination, unit, team));
        steps.addAll(activationSteps(destination, team, unit));
        return execute(steps);
    }

    /**
     * Places a main unit on a random free tile of the team, outside the tiles its skill claims.
     * Candidates are ordered by descending tile id before drawing, so the choice depends only on the
     * random provider's state.
     */
    public boolean autoPlace(UnitId unit, Team team) {
        if (unit.isCompanion() || grid.hasUnit(unit, team) || grid.isTeamFull(team)) {
            return false;
        }
        List<Tile> free = freeTilesOutside(team, skills.claimedTiles(unit, team));
        if (free.isEmpty()) {
            return false;
        }
        Collections.reverse(free);
        Tile chosen = free.get(random.nextInt(free.size()));
        return place(chosen.getId(), unit, team);
    }

    /**
     * Removes the occupant of a tile. Removing a companion removes its main unit, which takes all of
     * its companions along; a companion whose main unit is gone is removed alone.
     *
     * @return {@code true}, also when the tile was already empty
     */
    public boolean remove(int tileId) {
        Tile tile = grid.getTileById(tileId);
        if (!tile.isOccupied()) {
            return true;
        }
        UnitId unit = tile.getOccupant();
        Team team = tile.getOccupantTeam();

        if (unit.isCompanion()) {
            int mainTile = grid.findUnitTile(unit.owner(), team);
            if (mainTile >= 0) {
                return remove(mainTile);
            }
            return execute(
                new TransactionStep("unlink " + unit,
                    () -> {
                        grid.removeCompanionLink(unit.owner(), team, unit);
                        return true;
                    },
                    () -> grid.addCompanionLink(unit.owner(), team, unit)),
                removeStep(tileId));
        }
        return execute(deactivateStep(unit, team), removeStep(tileId));
    }

    /**
     * Moves a unit to an empty tile. The destination's zone decides the unit's team; a unit that
     * changes team has its skill deactivated and then re-activated under the new team.
     *
     * @return {@code false} if the source does not hold {@code unit}, the destination is occupied
     *         or cannot host a team, or a companion would change team
     */
    public boolean move(int fromTileId, int toTileId, UnitId unit) {
        if (fromTileId == toTileId) {
            return false;
        }
        Tile from = grid.getTileById(fromTileId);
        Tile to = grid.getTileById(toTileId);
        if (!unit.equals(from.getOccupant()) || to.isOccupied()) {
            return false;
        }
        Team fromTeam = from.getOccupantTeam();
        Team toTeam = to.getState().team();
        if (toTeam == null) {
            return false;
        }
        boolean changingTeams = fromTeam != toTeam;
        if (unit.isCompanion() && changingTeams) {
            LOG.debug("Rejected move of companion {} to {}", unit, toTeam);
            return false;
        }

        List<TransactionStep> steps = new ArrayList<>();
        boolean rekeySkill = changingTeams && skills.getRegistry().hasSkill(unit);
        if (rekeySkill) {
            steps.add(deactivateStep(unit, fromTeam));
        }
        steps.add(removeStep(fromTileId));
        steps.add(placeStep(toTileId, unit, toTeam));
        if (rekeySkill) {
            steps.addAll(activationSteps(toTileId, toTeam, unit));
        }
        return execute(steps);
    }

    /**
     * Exchanges the occupants of two tiles. Each unit joins the team of the tile it lands on.
     *
     * @return {@code false} if either tile is empty, a companion would change team, or the swap
     *         would put a unit on a team that already has it
     */
    public boolean swap(int tileA, int tileB) {
        if (tileA == tileB) {
            return false;
        }
        Tile a = grid.getTileById(tileA);
        Tile b = grid.getTileById(tileB);
        if (!a.isOccupied() || !b.isOccupied()) {
            return false;
        }
        UnitId unitA = a.getOccupant();
        UnitId unitB = b.getOccupant();
        Team teamA = a.getOccupantTeam();
        Team teamB = b.getOccupantTeam();
        boolean crossTeam = teamA != teamB;
        if (crossTeam) {
            if (unitA.isCompanion() || unitB.isCompanion()) {
                LOG.debug("Rejected cross-team swap involving a companion ({}, {})", unitA, unitB);
                return false;
            }
            if (grid.hasUnit(unitA, teamB) || grid.hasUnit(unitB, teamA)) {
                LOG.debug("Rejected swap of {} and {}: would duplicate a unit", unitA, unitB);
                return false;
            }
        }

        boolean rekeySkills = crossTeam
            && (skills.getRegistry().hasSkill(unitA) || skills.getRegistry().hasSkill(unitB));
        List<TransactionStep> steps = new ArrayList<>();
        if (rekeySkills) {
            steps.add(deactivateStep(unitA, teamA));
            steps.add(deactivateStep(unitB, teamB));
        }
        steps.add(removeStep(tileA));
        steps.add(removeStep(tileB));
        steps.add(placeStep(tileA, unitB, teamA));
        steps.add(placeStep(tileB, unitA, teamB));
        if (rekeySkills) {
            steps.addAll(activationSteps(tileB, teamB, unitA));
            steps.addAll(activationSteps(tileA, teamA, unitB));
        }
        return execute(steps);
    }

    /**
     * Deactivates every skill and removes every unit. Capacities are kept.
     */
    public boolean clearAll() {
        return execute(TransactionStep.of("clear all", () -> {
            skills.deactivateAll();
            grid.clearAllUnits();
            return true;
        }));
    }

    /**
     * Paints a tile for the map editor. An occupant is removed first, with the usual cascade.
     *
     * @return {@code false} if the state cannot be painted (see {@link SpatialGrid#setOccupancyState})
     */
    public boolean paintTile(int tileId, TileState state) {
        Tile tile = grid.getTileById(tileId);
        if (state == null || state.isOccupied()) {
            return false;
        }
        return execute(
            TransactionStep.of("clear tile " + tileId, () -> remove(tileId)),
            paintStep(tile, state));
    }

    public boolean setMaxTeamSize(Team team, int size) {
        int previous = grid.getMaxTeamSize(team);
        return execute(new TransactionStep("capacity of " + team + " to " + size,
            () -> grid.setMaxTeamSize(team, size),
            () -> grid.setMaxTeamSize(team, previous)));
    }

    /**
     * Deactivates every skill, clears the board and applies another arena's tile states.
     */
    public boolean resetToArena(ArenaMap arena) {
        return execute(TransactionStep.of("reset to " + arena.getKey(), () -> {
            skills.deactivateAll();
            grid.resetToArena(arena);
            return true;
        }));
    }

    /**
     * Deactivates every skill, clears the board and mirrors the tile states so the zones trade sides.
     */
    public boolean flipArena() {
        return execute(TransactionStep.of("flip arena", () -> {
            skills.deactivateAll();
            grid.flipArena();
            return true;
        }));
    }

    // ==================== Steps ====================

    private TransactionStep placeStep(int tileId, UnitId unit, Team team) {
        return new TransactionStep("place " + unit + " on " + tileId,
            () -> grid.placeUnit(tileId, unit, team),
            () -> grid.removeUnit(tileId));
    }

    private TransactionStep removeStep(int tileId) {
        Tile tile = grid.getTileById(tileId);
        UnitId[] removed = new UnitId[1];
        Team[] removedTeam = new Team[1];
        return new TransactionStep("remove from " + tileId,
            () -> {
                removed[0] = tile.getOccupant();
                removedTeam[0] = tile.getOccupantTeam();
                return grid.removeUnit(tileId);
            },
            () -> {
                if (!grid.placeUnit(tileId, removed[0], removedTeam[0])) {
                    LOG.warn("Failed to restore {} on tile {}", removed[0], tileId);
                }
            });
    }

    /**
     * Empties the tiles the skill claims, with the usual removal cascade, then activates it.
     */
    private List<TransactionStep> activationSteps(int tileId, Team team, UnitId unit) {
        IntList claimed = skills.claimedTiles(unit, team);
        if (claimed.isEmpty()) {
            return List.of(activateStep(tileId, team, unit));
        }
        TransactionStep clearClaim = TransactionStep.of("clear tiles claimed by " + unit, () -> {
            for (int i = 0; i < claimed.size(); i++) {
                int claimedId = claimed.getInt(i);
                Tile tile = grid.getTileById(claimedId);
                boolean isCaster = unit.equals(tile.getOccupant()) && tile.getOccupantTeam() == team;
                if (tile.isOccupied() && !isCaster && !remove(claimedId)) {
                    return false;
                }
            }
            return true;
        });
        return List.of(clearClaim, activateStep(tileId, team, unit));
    }

    private TransactionStep activateStep(int tileId, Team team, UnitId unit) {
        return new TransactionStep("activate skill of " + unit,
            () -> skills.activate(tileId, team, unit),
            () -> skills.deactivate(unit, team));
    }

    private List<Tile> freeTilesOutside(Team team, IntList excluded) {
        List<Tile> free = new ArrayList<>();
        for (Tile tile : grid.getAvailableTiles(team)) {
            if (!excluded.contains(tile.getId())) {
                free.add(tile);
            }
        }
        return free;
    }

    /**
     * Deactivates a skill, remembering where its companions stood so a rollback can put them back
     * without drawing new tiles.
     */
    private TransactionStep deactivateStep(UnitId unit, Team team) {
        int[] tileId = {-1};
        Map<UnitId, Integer> companionTiles = new LinkedHashMap<>();
        return new TransactionStep("deactivate skill of " + unit,
            () -> {
                if (!skills.isActive(unit, team)) {
                    return true;
                }
                tileId[0] = grid.findUnitTile(unit, team);
                for (UnitId companion : grid.getCompanions(unit, team)) {
                    int companionTile = grid.findUnitTile(companion, team);
                    if (companionTile >= 0) {
                        companionTiles.put(companion, companionTile);
                    }
                }
                skills.deactivate(unit, team);
                return true;
            },
            () -> {
                if (tileId[0] < 0) {
                    return;
                }
                if (!skills.reactivate(tileId[0], team, unit, companionTiles)) {
                    throw new IllegalStateException("Failed to re-activate skill of " + unit + " on tile " + tileId[0]);
                }
            });
    }

    private TransactionStep paintStep(Tile tile, TileState state) {
        TileState[] previous = new TileState[1];
        return new TransactionStep("paint " + tile.getId() + " as " + state,
            () -> {
                previous[0] = tile.getState();
                return grid.setOccupancyState(tile.getCoordinate(), state);
            },
            () -> grid.setOccupancyState(tile.getCoordinate(), previous[0]));
    }
}
