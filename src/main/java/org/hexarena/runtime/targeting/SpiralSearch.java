package org.hexarena.runtime.targeting;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.hexarena.runtime.model.HexCoordinate;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.Tile;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Fallback search that walks rings around a center tile in a fixed angular order and returns the
 * first candidate it meets.
 * <p>
 * Rings are walked at distance 1, 2, ... up to the furthest candidate. Within a ring, each tile's
 * bearing from the center is {@code atan2(sqrt(3) * (dr + dq / 2), 1.5 * dq)} and tiles are walked
 * in ascending order of a per-team normalized bearing:
 * <ul>
 *   <li>ALLY casters: {@code (bearing + pi/6) mod 2pi}, a clockwise walk that begins at the
 *       upper-right neighbor.</li>
 *   <li>ENEMY casters: {@code 2pi - ((bearing - 5pi/6) mod 2pi)}, a counter-clockwise walk that
 *       begins just past the lower-left neighbor.</li>
 * </ul>
 * These bearings are fixed conventions checked against golden ring orders; they are evaluated with
 * {@link StrictMath} so the order is identical on every JVM.
 */
public final class SpiralSearch {

    private static final double TWO_PI = 2 * Math.PI;

    private SpiralSearch() {}

    /**
     * @param centerTileId tile to spiral around
     * @param casterTeam   team whose walk direction applies
     * @param candidates   tiles holding eligible targets
     * @return the first candidate met, or {@code null} if there are none
     */
    public static TargetInfo search(SpatialGrid grid, int centerTileId, Team casterTeam, List<Tile> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        HexCoordinate center = grid.getTileById(centerTileId).getCoordinate();
        Int2ObjectOpenHashMap<Tile> byId = new Int2ObjectOpenHashMap<>();
        int maxDistance = 0;
        for (Tile candidate : candidates) {
            byId.put(candidate.getId(), candidate);
            maxDistance = Math.max(maxDistance, center.distanceTo(candidate.getCoordinate()));
        }

        IntList examined = new IntArrayList();
        for (int distance = 1; distance <= maxDistance; distance++) {
            for (int tileId : ringOrder(grid, centerTileId, distance, casterTeam)) {
                examined.add(tileId);
                Tile hit = byId.get(tileId);
                if (hit != null) {
                    return new TargetInfo(hit.getId(), hit.getOccupant(), Map.of(
                        TargetInfo.MIRROR_TILE, centerTileId,
                        TargetInfo.MIRROR_HIT, false,
                        TargetInfo.DISTANCE, distance,
                        TargetInfo.EXAMINED_TILES, List.copyOf(examined)));
                }
            }
        }
        return null;
    }

    /**
     * Returns the on-board tiles at exactly {@code distance} from the center, in walk order.
     */
    public static int[] ringOrder(SpatialGrid grid, int centerTileId, int distance, Team casterTeam) {
        HexCoordinate center = grid.getTileById(centerTileId).getCoordinate();
        List<double[]> ring = new ArrayList<>();
        for (Tile tile : grid.getAllTiles()) {
            HexCoordinate coord = tile.getCoordinate();
            if (center.distanceTo(coord) != distance) {
                continue;
            }
            int dq = coord.getQ() - center.getQ();
            int dr = coord.getR() - center.getR();
            ring.add(new double[] {tile.getId(), normalizedBearing(dq, dr, casterTeam)});
        }
        ring.sort(Comparator.comparingDouble(entry -> entry[1]));
        int[] order = new int[ring.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = (int) ring.get(i)[0];
        }
        return order;
    }

    static double normalizedBearing(int dq, int dr, Team casterTeam) {
        double x = 1.5 * dq;
        double y = StrictMath.sqrt(3) * (dr + dq / 2.0);
        double angle = StrictMath.atan2(y, x);
        if (casterTeam == Team.ALLY) {
            return (angle + Math.PI / 6 + TWO_PI) % TWO_PI;
        }
        double shifted = (angle - 5 * Math.PI / 6 + TWO_PI) % TWO_PI;
        return TWO_PI - shifted;
    }
}
