package org.hexarena.runtime.pathfinding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.Predicate;

import org.hexarena.runtime.Config;
import org.hexarena.runtime.model.HexCoordinate;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Movement searches over a {@link SpatialGrid}.
 * <p>
 * Two searches are provided, both parameterized by a traversability predicate:
 * <ul>
 *   <li><strong>Shortest path</strong> ({@link #findPath}): A* with exact hex distance as the
 *       heuristic. Gives up after {@code maxNodesExplored} discovered nodes and reports no path.</li>
 *   <li><strong>Minimum moves to range</strong> ({@link #minMovesToRange}): ring-by-ring BFS that
 *       stops at the first depth from which any target is within range and reports every target in
 *       range at that depth. Gives up after {@code maxMovementDistance} rings.</li>
 * </ul>
 * Occupied tiles are traversable; only blocked tiles stop movement under the default predicate.
 * <p>
 * Results for the default predicate are cached in the injected {@link IPathfindingCache} under
 * keys that include the grid's modification count.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe.
 */
public class PathfindingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PathfindingEngine.class);

    /** Moves reported for goals that cannot be reached. */
    public static final int UNREACHABLE = Integer.MAX_VALUE;

    /** Every tile except blocked and breakable-blocked ones. */
    public static final Predicate<Tile> DEFAULT_TRAVERSABLE = tile -> !tile.getState().isBlocked();

    private static final HexCoordinate[] NO_PATH = new HexCoordinate[0];

    private final SpatialGrid grid;
    private final IPathfindingCache cache;
    private final int maxNodesExplored;
    private final int maxMovementDistance;

    public PathfindingEngine(SpatialGrid grid) {
        this(grid, new LruPathfindingCache());
    }

    public PathfindingEngine(SpatialGrid grid, IPathfindingCache cache) {
        this(grid, cache, Config.MAX_NODES_EXPLORED, Config.MAX_MOVEMENT_DISTANCE);
    }

    public PathfindingEngine(SpatialGrid grid, IPathfindingCache cache, int maxNodesExplored, int maxMovementDistance) {
        this.grid = grid;
        this.cache = cache;
        this.maxNodesExplored = maxNodesExplored;
        this.maxMovementDistance = maxMovementDistance;
    }

    public SpatialGrid getGrid() {
        return grid;
    }

    public IPathfindingCache getCache() {
        return cache;
    }

    /**
     * Drops all cached results. Called once at the end of every mutating transaction.
     */
    public void invalidate() {
        cache.invalidate();
    }

    // ==================== Shortest Path ====================

    /**
     * Finds a shortest path under the default predicate.
     *
     * @return the tiles from start to goal inclusive, or {@code null} if the goal is unreachable
     * @throws org.hexarena.runtime.model.TileNotFoundException if either endpoint is off the board
     */
    public List<HexCoordinate> findPath(HexCoordinate start, HexCoordinate goal) {
        HexCoordinate from = grid.getTile(start).getCoordinate();
        HexCoordinate to = grid.getTile(goal).getCoordinate();
        String key = from.getId() + ":" + to.getId() + ":" + grid.getModificationCount();
        HexCoordinate[] cached = cache.get(CacheRegion.PATHS, key);
        if (cached != null) {
            return cached.length == 0 ? null : List.of(cached);
        }
        List<HexCoordinate> path = findPath(from, to, DEFAULT_TRAVERSABLE);
        cache.put(CacheRegion.PATHS, key, path == null ? NO_PATH : path.toArray(NO_PATH));
        return path;
    }

    /**
     * Finds a shortest path with A*. The start tile is never tested against the predicate.
     *
     * @return the tiles from start to goal inclusive, or {@code null} if the goal is unreachable
     *         or the search exceeded its node ceiling
     * @throws org.hexarena.runtime.model.TileNotFoundException if either endpoint is off the board
     */
    public List<HexCoordinate> findPath(HexCoordinate start, HexCoordinate goal, Predicate<Tile> canTraverse) {
        Tile startTile = grid.getTile(start);
        Tile goalTile = grid.getTile(goal);
        HexCoordinate goalCoord = goalTile.getCoordinate();

        PriorityQueue<SearchNode> open = new PriorityQueue<>(SearchNode.ORDER);
        IntSet closed = new IntOpenHashSet();
        Int2IntOpenHashMap gCost = new Int2IntOpenHashMap();
        Int2IntOpenHashMap cameFrom = new Int2IntOpenHashMap();
        gCost.defaultReturnValue(Integer.MAX_VALUE);

        int sequence = 0;
        int startH = startTile.getCoordinate().distanceTo(goalCoord);
        open.add(new SearchNode(startTile.getId(), 0, startH, sequence++));
        gCost.put(startTile.getId(), 0);

        while (!open.isEmpty()) {
            SearchNode current = open.poll();
            if (closed.contains(current.tileId) || current.g > gCost.get(current.tileId)) {
                continue;
            }
            if (gCost.size() > maxNodesExplored) {
                LOG.warn("A* search limit reached ({} nodes) between {} and {}, aborting", maxNodesExplored, start, goal);
                return null;
            }
            if (current.tileId == goalTile.getId()) {
                return reconstruct(cameFrom, current.tileId, startTile.getId());
            }
            closed.add(current.tileId);

            HexCoordinate currentCoord = grid.getTileById(current.tileId).getCoordinate();
            for (int dir = 0; dir < 6; dir++) {
                Tile neighbor = grid.findTile(currentCoord.neighbor(dir));
                if (neighbor == null || closed.contains(neighbor.getId()) || !canTraverse.test(neighbor)) {
                    continue;
                }
                int tentative = current.g + 1;
                if (tentative < gCost.get(neighbor.getId())) {
                    gCost.put(neighbor.getId(), tentative);
                    cameFrom.put(neighbor.getId(), current.tileId);
                    int h = neighbor.getCoordinate().distanceTo(goalCoord);
                    open.add(new SearchNode(neighbor.getId(), tentative, h, sequence++));
                }
            }
        }
        return null;
    }

    /**
     * @return number of steps on a shortest path, or -1 if the goal is unreachable
     */
    public int pathDistance(HexCoordinate start, HexCoordinate goal) {
        List<HexCoordinate> path = findPath(start, goal);
        return path == null ? -1 : path.size() - 1;
    }

    private List<HexCoordinate> reconstruct(Int2IntOpenHashMap cameFrom, int goalId, int startId) {
        List<HexCoordinate> path = new ArrayList<>();
        int id = goalId;
        path.add(grid.getTileById(id).getCoordinate());
        while (id != startId) {
            id = cameFrom.get(id);
            path.add(grid.getTileById(id).getCoordinate());
        }
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }

    // ==================== Effective Distance ====================

    /**
     * Computes how many moves a unit with the given range needs before {@code goal} is in range.
     * A goal already within range needs no moves, even through obstacles.
     */
    public EffectiveDistance effectiveDistance(HexCoordinate start, HexCoordinate goal, int range) {
        HexCoordinate from = grid.getTile(start).getCoordinate();
        HexCoordinate to = grid.getTile(goal).getCoordinate();
        String key = from.getId() + ":" + to.getId() + ":" + range + ":" + grid.getModificationCount();
        EffectiveDistance cached = cache.get(CacheRegion.EFFECTIVE_DISTANCES, key);
        if (cached != null) {
            return cached;
        }

        int direct = from.distanceTo(to);
        EffectiveDistance result;
        if (direct <= range) {
            result = new EffectiveDistance(0, true, direct);
        } else {
            List<HexCoordinate> path = findPath(from, to);
            result = path == null
                ? new EffectiveDistance(UNREACHABLE, false, direct)
                : new EffectiveDistance(Math.max(0, path.size() - 1 - range), true, direct);
        }
        cache.put(CacheRegion.EFFECTIVE_DISTANCES, key, result);
        return result;
    }

    // ==================== Minimum Moves To Range ====================

    /**
     * Minimum-moves-to-range search under the default predicate.
     *
     * @see #minMovesToRange(HexCoordinate, Collection, int, Predicate)
     */
    public RangedDistance minMovesToRange(HexCoordinate start, Collection<HexCoordinate> targets, int range) {
        HexCoordinate from = grid.getTile(start).getCoordinate();
        int[] targetIds = new int[targets.size()];
        int i = 0;
        for (HexCoordinate target : targets) {
            targetIds[i++] = grid.getTile(target).getId();
        }
        Arrays.sort(targetIds);
        String key = from.getId() + ":" + Arrays.toString(targetIds) + ":" + range + ":" + grid.getModificationCount();
        RangedDistance cached = cache.get(CacheRegion.RANGED_DISTANCES, key);
        if (cached != null) {
            return cached;
        }
        RangedDistance result = minMovesToRange(from, targets, range, DEFAULT_TRAVERSABLE);
        cache.put(CacheRegion.RANGED_DISTANCES, key, result);
        return result;
    }

    /**
     * Finds the fewest moves after which at least one target is within {@code range}.
     * <p>
     * Depth 0 (the start tile itself) is checked first. Each following ring tests every newly
     * visited tile against every target; the first ring that brings a target into range ends the
     * search and all targets in range from that ring are returned, so callers can break ties among
     * equally close targets.
     *
     * @return the distance and reachable targets, or {@link RangedDistance#NONE} if no target comes
     *         into range within {@code maxMovementDistance} moves
     */
    public RangedDistance minMovesToRange(HexCoordinate start, Collection<HexCoordinate> targets, int range,
                                          Predicate<Tile> canTraverse) {
        if (targets.isEmpty()) {
            return RangedDistance.NONE;
        }
        List<HexCoordinate> boundTargets = new ArrayList<>(targets.size());
        for (HexCoordinate target : targets) {
            boundTargets.add(grid.getTile(target).getCoordinate());
        }
        HexCoordinate origin = grid.getTile(start).getCoordinate();

        IntSet inRange = new IntOpenHashSet();
        collectInRange(origin, boundTargets, range, inRange);
        if (!inRange.isEmpty()) {
            return new RangedDistance(0, sortedTargets(boundTargets, inRange));
        }

        IntSet visited = new IntOpenHashSet();
        visited.add(origin.getId());
        List<HexCoordinate> frontier = List.of(origin);
        int depth = 0;
        while (!frontier.isEmpty() && depth < maxMovementDistance) {
            List<HexCoordinate> next = new ArrayList<>();
            for (HexCoordinate current : frontier) {
                for (int dir = 0; dir < 6; dir++) {
                    Tile neighbor = grid.findTile(current.neighbor(dir));
                    if (neighbor == null || visited.contains(neighbor.getId()) || !canTraverse.test(neighbor)) {
                        continue;
                    }
                    visited.add(neighbor.getId());
                    next.add(neighbor.getCoordinate());
                    collectInRange(neighbor.getCoordinate(), boundTargets, range, inRange);
                }
            }
            if (!inRange.isEmpty()) {
                return new RangedDistance(depth + 1, sortedTargets(boundTargets, inRange));
            }
            frontier = next;
            depth++;
        }
        return RangedDistance.NONE;
    }

    private static void collectInRange(HexCoordinate position, List<HexCoordinate> targets, int range, IntSet sink) {
        for (HexCoordinate target : targets) {
            if (position.distanceTo(target) <= range) {
                sink.add(target.getId());
            }
        }
    }

    private static List<HexCoordinate> sortedTargets(List<HexCoordinate> targets, IntSet ids) {
        List<HexCoordinate> result = new ArrayList<>(ids.size());
        IntSet seen = new IntOpenHashSet();
        for (HexCoordinate target : targets) {
            if (ids.contains(target.getId()) && seen.add(target.getId())) {
                result.add(target);
            }
        }
        result.sort(Comparator.comparingInt(HexCoordinate::getId));
        return Collections.unmodifiableList(result);
    }

    /**
     * Open-list entry. Ordered by f = g + h, then by h (closer to the goal first), then by insertion
     * order so equal-cost expansions are deterministic.
     */
    private static final class SearchNode {

        static final Comparator<SearchNode> ORDER = Comparator
            .comparingInt((SearchNode n) -> n.g + n.h)
            .thenComparingInt(n -> n.h)
            .thenComparingInt(n -> n.sequence);

        final int tileId;
        final int g;
        final int h;
        final int sequence;

        SearchNode(int tileId, int g, int h, int sequence) {
            this.tileId = tileId;
            this.g = g;
            this.h = h;
            this.sequence = sequence;
        }
    }
}
