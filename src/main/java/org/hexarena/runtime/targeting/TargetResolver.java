package org.hexarena.runtime.targeting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.hexarena.runtime.model.BoardLayout;
import org.hexarena.runtime.model.HexCoordinate;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.Tile;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.pathfinding.CacheRegion;
import org.hexarena.runtime.pathfinding.PathfindingEngine;
import org.hexarena.runtime.pathfinding.RangedDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Deterministic target selection.
 * <p>
 * The primary strategy is {@link #resolveClosest}: the candidates needing the fewest moves to come
 * into range are found with {@link PathfindingEngine#minMovesToRange}, and one of them is chosen by
 * a fixed positional tie-break (see {@link #breakTie}). The remaining strategies ({@link TargetingMethod})
 * are selected per skill and never fall back on each other, except that the mirror strategy hands
 * over to {@link SpiralSearch} when the mirror tile holds no target and the row strategy hands over
 * to {@link #ringScan} when the caster's row holds none.
 * <p>
 * Every strategy is a pure function of the board: evaluating it twice on an unchanged board gives
 * the same result. Candidate lists are expected in ascending tile-id order, as produced by
 * {@link #candidates}.
 */
public class TargetResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TargetResolver.class);

    private record ClosestTargets(Map<Integer, TargetInfo> bySourceTile) {}

    /** Whole-board closest-target maps, keyed by team pair and board fingerprint. */
    private static final CacheRegion<ClosestTargets> CLOSEST_TARGET_MAPS =
        new CacheRegion<>("closest-target-maps", ClosestTargets.class, true);

    private final SpatialGrid grid;
    private final PathfindingEngine pathfinding;
    private final IRangeProvider ranges;

    public TargetResolver(SpatialGrid grid, PathfindingEngine pathfinding, IRangeProvider ranges) {
        this.grid = grid;
        this.pathfinding = pathfinding;
        this.ranges = ranges;
    }

    public SpatialGrid getGrid() {
        return grid;
    }

    public int rangeOf(UnitId unit) {
        return ranges.rangeOf(unit);
    }

    // ==================== Candidate Pools ====================

    /**
     * Collects the tiles holding units of a team.
     *
     * @param team              team whose units are eligible
     * @param exclude           unit to leave out (usually the caster), or {@code null}
     * @param includeCompanions whether companion units are eligible
     * @return candidate tiles ascending by id
     */
    public List<Tile> candidates(Team team, UnitId exclude, boolean includeCompanions) {
        List<Tile> result = new ArrayList<>();
        for (Tile tile : grid.getOccupiedTiles()) {
            if (tile.getOccupantTeam() != team) {
                continue;
            }
            UnitId unit = tile.getOccupant();
            if (unit.equals(exclude) || (!includeCompanions && unit.isCompanion())) {
                continue;
            }
            result.add(tile);
        }
        return result;
    }

    // ==================== Closest (movement-based) ====================

    /**
     * Picks the candidate that a unit on {@code sourceTileId} with the given range can engage after
     * the fewest moves.
     *
     * @return the winner, or {@code null} if there are no candidates or none can be brought into range
     */
    public TargetInfo resolveClosest(int sourceTileId, Team sourceTeam, int range, List<Tile> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        Tile source = grid.getTileById(sourceTileId);
        List<HexCoordinate> targets = new ArrayList<>(candidates.size());
        for (Tile candidate : candidates) {
            targets.add(candidate.getCoordinate());
        }
        RangedDistance reach = pathfinding.minMovesToRange(source.getCoordinate(), targets, range);
        if (!reach.canReach()) {
            LOG.debug("No candidate reachable from tile {} with range {}", sourceTileId, range);
            return null;
        }

        IntSet reachable = new IntOpenHashSet();
        for (HexCoordinate coord : reach.reachableTargets()) {
            reachable.add(coord.getId());
        }
        List<Tile> tied = new ArrayList<>();
        for (Tile candidate : candidates) {
            if (reachable.contains(candidate.getId())) {
                tied.add(candidate);
            }
        }
        tied.sort(Comparator.comparingInt(Tile::getId));

        Tile best = breakTie(grid.getLayout(), source.getCoordinate(), sourceTeam, tied);
        return new TargetInfo(best.getId(), best.getOccupant(), Map.of(
            TargetInfo.SOURCE_TILE, sourceTileId,
            TargetInfo.MOVEMENT_DISTANCE, reach.movementDistance()));
    }

    /**
     * Chooses one tile among candidates that are equally close in moves. Candidates are visited in
     * list order while keeping a running best:
     * <ol>
     *   <li>A candidate in the source's column (same q) beats one that is not.</li>
     *   <li>Otherwise, if candidate and best share a diagonal row, ALLY sources take the higher id and
     *       ENEMY sources the lower id.</li>
     *   <li>Otherwise, if neither is in the source's column, the smaller raw distance wins and equal
     *       distances fall back to the id preference of rule 2.</li>
     * </ol>
     * Two column-aligned candidates in different rows keep the earlier one.
     *
     * @param candidates non-empty list
     */
    public static Tile breakTie(BoardLayout layout, HexCoordinate source, Team sourceTeam, List<Tile> candidates) {
        Tile best = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            Tile candidate = candidates.get(i);
            boolean candidateVertical = candidate.getCoordinate().getQ() == source.getQ();
            boolean bestVertical = best.getCoordinate().getQ() == source.getQ();

            if (candidateVertical && !bestVertical) {
                best = candidate;
            } else if (!candidateVertical && bestVertical) {
                continue;
            } else if (layout.sameDiagonalRow(candidate.getId(), best.getId())) {
                if (prefersById(sourceTeam, candidate.getId(), best.getId())) {
                    best = candidate;
                }
            } else if (!candidateVertical) {
                int candidateDistance = source.distanceTo(candidate.getCoordinate());
                int bestDistance = source.distanceTo(best.getCoordinate());
                if (candidateDistance < bestDistance
                    || (candidateDistance == bestDistance && prefersById(sourceTeam, candidate.getId(), best.getId()))) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    private static boolean prefersById(Team sourceTeam, int candidateId, int bestId) {
        return sourceTeam == Team.ENEMY ? candidateId < bestId : candidateId > bestId;
    }

    /**
     * Resolves the closest target of {@code targetTeam} for every unit of {@code sourceTeam}, using
     * each unit's own range. Results are cached per board state.
     *
     * @return source tile id to target, in ascending source tile order; units without a reachable
     *         target are absent
     */
    public Map<Integer, TargetInfo> closestTargetMap(Team sourceTeam, Team targetTeam) {
        String key = sourceTeam + ":" + targetTeam + ":" + grid.getModificationCount();
        ClosestTargets cached = pathfinding.getCache().get(CLOSEST_TARGET_MAPS, key);
        if (cached != null) {
            return cached.bySourceTile();
        }
        List<Tile> targets = candidates(targetTeam, null, true);
        Map<Integer, TargetInfo> result = new LinkedHashMap<>();
        for (Tile source : candidates(sourceTeam, null, true)) {
            TargetInfo target = resolveClosest(source.getId(), sourceTeam, ranges.rangeOf(source.getOccupant()), targets);
            if (target != null) {
                result.put(source.getId(), target);
            }
        }
        Map<Integer, TargetInfo> frozen = Collections.unmodifiableMap(result);
        pathfinding.getCache().put(CLOSEST_TARGET_MAPS, key, new ClosestTargets(frozen));
        return frozen;
    }

    // ==================== Raw-distance Strategies ====================

    /**
     * Picks the candidate with the smallest ({@code furthest == false}) or largest raw hex distance
     * from the source. Equal distances go to the lower id for ALLY casters and the higher id for
     * ENEMY casters.
     */
    public TargetInfo findByDistance(int sourceTileId, Team casterTeam, List<Tile> candidates, boolean furthest) {
        if (candidates.isEmpty()) {
            return null;
        }
        HexCoordinate source = grid.getTileById(sourceTileId).getCoordinate();
        Comparator<Tile> byDistance = Comparator.comparingInt(t -> source.distanceTo(t.getCoordinate()));
        if (furthest) {
            byDistance = byDistance.reversed();
        }
        Comparator<Tile> byId = Comparator.comparingInt(Tile::getId);
        if (casterTeam == Team.ENEMY) {
            byId = byId.reversed();
        }
        List<Tile> sorted = new ArrayList<>(candidates);
        sorted.sort(byDistance.thenComparing(byId));
        Tile winner = sorted.get(0);
        return new TargetInfo(winner.getId(), winner.getOccupant(), Map.of(
            TargetInfo.SOURCE_TILE, sourceTileId,
            TargetInfo.DISTANCE, source.distanceTo(winner.getCoordinate())));
    }

    // ==================== Positional Strategies ====================

    /**
     * The candidate closest to the opposing side: lowest id when targeting ENEMY units, highest id
     * when targeting ALLY units.
     */
    public TargetInfo frontmost(Team targetTeam, List<Tile> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        Tile winner = candidates.get(0);
        for (Tile candidate : candidates) {
            boolean better = targetTeam == Team.ENEMY
                ? candidate.getId() < winner.getId()
                : candidate.getId() > winner.getId();
            if (better) {
                winner = candidate;
            }
        }
        return new TargetInfo(winner.getId(), winner.getOccupant());
    }

    /**
     * The {@code count} candidates furthest back on their own side, rearmost first: highest ids when
     * targeting ENEMY units, lowest ids when targeting ALLY units.
     */
    public List<TargetInfo> rearmost(Team targetTeam, List<Tile> candidates, int count) {
        List<Tile> sorted = new ArrayList<>(candidates);
        Comparator<Tile> byId = Comparator.comparingInt(Tile::getId);
        sorted.sort(targetTeam == Team.ENEMY ? byId.reversed() : byId);
        List<TargetInfo> result = new ArrayList<>();
        for (int i = 0; i < Math.min(count, sorted.size()); i++) {
            Tile tile = sorted.get(i);
            result.add(new TargetInfo(tile.getId(), tile.getOccupant()));
        }
        return result;
    }

    /**
     * Targets the candidate on the caster's mirror tile, else the first candidate a spiral search
     * around the mirror tile meets.
     */
    public TargetInfo mirror(int sourceTileId, Team casterTeam, List<Tile> candidates) {
        int mirrorId = grid.getLayout().mirrorOf(sourceTileId);
        if (mirrorId < 0 || candidates.isEmpty()) {
            return null;
        }
        for (Tile candidate : candidates) {
            if (candidate.getId() == mirrorId) {
                return new TargetInfo(mirrorId, candidate.getOccupant(), Map.of(
                    TargetInfo.MIRROR_TILE, mirrorId,
                    TargetInfo.MIRROR_HIT, true,
                    TargetInfo.EXAMINED_TILES, List.of(mirrorId)));
            }
        }
        return SpiralSearch.search(grid, mirrorId, casterTeam, candidates);
    }

    /**
     * Targets the nearest candidate in the caster's diagonal row (ALLY casters prefer the higher id
     * at equal distance, ENEMY casters the lower). Without such a candidate, falls back to
     * {@link #ringScan} in the given direction.
     */
    public TargetInfo row(int sourceTileId, Team casterTeam, List<Tile> candidates,
                          ScanDirection direction, int maxDistance) {
        TargetInfo sameRow = sameRow(sourceTileId, casterTeam, candidates);
        return sameRow != null ? sameRow : ringScan(sourceTileId, casterTeam, candidates, direction, maxDistance);
    }

    public TargetInfo row(int sourceTileId, Team casterTeam, List<Tile> candidates) {
        return row(sourceTileId, casterTeam, candidates, ScanDirection.FRONTMOST, 0);
    }

    /**
     * The nearest candidate in the caster's diagonal row, or {@code null} if none shares it.
     */
    public TargetInfo sameRow(int sourceTileId, Team casterTeam, List<Tile> candidates) {
        BoardLayout layout = grid.getLayout();
        HexCoordinate source = grid.getTileById(sourceTileId).getCoordinate();

        List<Tile> sameRow = new ArrayList<>();
        for (Tile candidate : candidates) {
            if (layout.sameDiagonalRow(sourceTileId, candidate.getId())) {
                sameRow.add(candidate);
            }
        }
        if (sameRow.isEmpty()) {
            return null;
        }
        Comparator<Tile> byId = Comparator.comparingInt(Tile::getId);
        sameRow.sort(Comparator.<Tile>comparingInt(t -> source.distanceTo(t.getCoordinate()))
            .thenComparing(casterTeam == Team.ALLY ? byId.reversed() : byId));
        Tile winner = sameRow.get(0);
        return new TargetInfo(winner.getId(), winner.getOccupant(), Map.of(
            TargetInfo.SOURCE_TILE, sourceTileId,
            TargetInfo.DISTANCE, source.distanceTo(winner.getCoordinate())));
    }

    /**
     * Scans rings of distance 1, 2, ... around the caster and returns the first candidate met.
     * Within a ring, tiles are visited by id in the order {@code direction} gives for the caster's
     * team. The scan stops at the furthest candidate, or at {@code maxDistance} if that is smaller.
     *
     * @param maxDistance ring limit; 0 or less means no limit
     * @return the first hit with the tiles examined up to it, or {@code null}
     */
    public TargetInfo ringScan(int sourceTileId, Team casterTeam, List<Tile> candidates,
                               ScanDirection direction, int maxDistance) {
        HexCoordinate source = grid.getTileById(sourceTileId).getCoordinate();
        int limit = 0;
        IntSet candidateIds = new IntOpenHashSet();
        for (Tile candidate : candidates) {
            candidateIds.add(candidate.getId());
            limit = Math.max(limit, source.distanceTo(candidate.getCoordinate()));
        }
        if (maxDistance > 0) {
            limit = Math.min(limit, maxDistance);
        }
        boolean ascending = direction.ascendingFor(casterTeam);
        IntList examined = new IntArrayList();
        for (int distance = 1; distance <= limit; distance++) {
            IntList ring = new IntArrayList();
            for (Tile tile : grid.getAllTiles()) {
                if (source.distanceTo(tile.getCoordinate()) == distance) {
                    ring.add(tile.getId());
                }
            }
            if (!ascending) {
                Collections.reverse(ring);
            }
            for (int i = 0; i < ring.size(); i++) {
                int tileId = ring.getInt(i);
                examined.add(tileId);
                if (candidateIds.contains(tileId)) {
                    Tile hit = grid.getTileById(tileId);
                    return new TargetInfo(tileId, hit.getOccupant(), Map.of(
                        TargetInfo.SOURCE_TILE, sourceTileId,
                        TargetInfo.DISTANCE, distance,
                        TargetInfo.EXAMINED_TILES, List.copyOf(examined)));
                }
            }
        }
        return null;
    }

    /**
     * Targets a candidate adjacent to the caster on its back side: lower ids for ALLY casters,
     * higher ids for ENEMY casters. Back tiles are ordered from the back line forward and tried
     * first, then last, then the middle one.
     */
    public TargetInfo behind(int sourceTileId, Team casterTeam, List<Tile> candidates) {
        HexCoordinate source = grid.getTileById(sourceTileId).getCoordinate();
        IntList back = new IntArrayList();
        for (Tile tile : grid.getAllTiles()) {
            boolean behind = casterTeam == Team.ALLY ? tile.getId() < sourceTileId : tile.getId() > sourceTileId;
            if (behind && source.distanceTo(tile.getCoordinate()) == 1) {
                back.add(tile.getId());
            }
        }
        if (casterTeam == Team.ENEMY) {
            Collections.reverse(back);
        }
        IntList priority = new IntArrayList();
        if (!back.isEmpty()) {
            priority.add(back.getInt(0));
            if (back.size() == 3) {
                priority.add(back.getInt(2));
                priority.add(back.getInt(1));
            } else if (back.size() == 2) {
                priority.add(back.getInt(1));
            }
        }
        for (int i = 0; i < priority.size(); i++) {
            int tileId = priority.getInt(i);
            for (Tile candidate : candidates) {
                if (candidate.getId() == tileId) {
                    return new TargetInfo(tileId, candidate.getOccupant(), Map.of(
                        TargetInfo.SOURCE_TILE, sourceTileId,
                        TargetInfo.DISTANCE, 1));
                }
            }
        }
        return null;
    }

    // ==================== Dispatch ====================

    /**
     * Resolves a single target with the given strategy, scanning rings frontmost first without a
     * distance limit.
     *
     * @param range caster range, used by {@link TargetingMethod#CLOSEST} only
     */
    public TargetInfo resolve(TargetingMethod method, int sourceTileId, Team casterTeam, Team targetTeam,
                              List<Tile> candidates, int range) {
        return resolve(method, sourceTileId, casterTeam, targetTeam, candidates, range, ScanDirection.FRONTMOST, 0);
    }

    /**
     * Resolves a single target with the given strategy.
     *
     * @param range       caster range, used by {@link TargetingMethod#CLOSEST} only
     * @param direction   ring visiting order for {@link TargetingMethod#RING} and the {@link TargetingMethod#ROW} fallback
     * @param maxDistance ring limit for the same strategies; 0 means none
     */
    public TargetInfo resolve(TargetingMethod method, int sourceTileId, Team casterTeam, Team targetTeam,
                              List<Tile> candidates, int range, ScanDirection direction, int maxDistance) {
        if (candidates.isEmpty()) {
            return null;
        }
        return switch (method) {
            case CLOSEST -> resolveClosest(sourceTileId, casterTeam, range, candidates);
            case NEAREST -> findByDistance(sourceTileId, casterTeam, candidates, false);
            case FURTHEST -> findByDistance(sourceTileId, casterTeam, candidates, true);
            case FRONTMOST -> frontmost(targetTeam, candidates);
            case REARMOST -> {
                List<TargetInfo> rear = rearmost(targetTeam, candidates, 1);
                yield rear.isEmpty() ? null : rear.get(0);
            }
            case MIRROR -> mirror(sourceTileId, casterTeam, candidates);
            case ROW -> row(sourceTileId, casterTeam, candidates, direction, maxDistance);
            case SAME_ROW -> sameRow(sourceTileId, casterTeam, candidates);
            case RING -> ringScan(sourceTileId, casterTeam, candidates, direction, maxDistance);
            case BEHIND -> behind(sourceTileId, casterTeam, candidates);
        };
    }
}
