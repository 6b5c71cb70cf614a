package org.hexarena.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable cube coordinate on a hexagonal board.
 * <p>
 * A coordinate always satisfies {@code q + r + s == 0}. Coordinates created through
 * {@link BoardLayout} are additionally bound to a stable board-position id, which is
 * carried along but not part of equality: two coordinates with the same (q, r, s) are
 * equal regardless of whether either one is bound.
 * <p>
 * All operations are pure and O(1).
 */
public final class HexCoordinate {

    /** Id of a coordinate not bound to any board. */
    public static final int UNBOUND_ID = -1;

    private static final int[][] DIRECTIONS = {
        {1, -1, 0},
        {1, 0, -1},
        {0, 1, -1},
        {-1, 1, 0},
        {-1, 0, 1},
        {0, -1, 1}
    };

    private final int q;
    private final int r;
    private final int s;
    private final int id;

    /**
     * Creates an unbound coordinate.
     *
     * @throws InvalidCoordinateException if {@code q + r + s != 0}
     */
    public HexCoordinate(int q, int r, int s) {
        this(q, r, s, UNBOUND_ID);
    }

    /**
     * Creates a coordinate bound to a board-position id.
     *
     * @throws InvalidCoordinateException if {@code q + r + s != 0}
     */
    public HexCoordinate(int q, int r, int s, int id) {
        if (q + r + s != 0) {
            throw new InvalidCoordinateException(q, r, s);
        }
        this.q = q;
        this.r = r;
        this.s = s;
        this.id = id;
    }

    /**
     * Creates an unbound coordinate from axial (q, r), deriving s.
     */
    public static HexCoordinate fromAxial(int q, int r) {
        return new HexCoordinate(q, r, -q - r);
    }

    public int getQ() {
        return q;
    }

    public int getR() {
        return r;
    }

    public int getS() {
        return s;
    }

    /**
     * @return the board-position id, or {@link #UNBOUND_ID} if this coordinate is not bound to a board.
     */
    public int getId() {
        return id;
    }

    public boolean isBound() {
        return id != UNBOUND_ID;
    }

    /**
     * Returns a copy of this coordinate bound to the given board-position id.
     */
    public HexCoordinate withId(int boardId) {
        return new HexCoordinate(q, r, s, boardId);
    }

    /**
     * Exact hex distance: {@code (|dq| + |dr| + |ds|) / 2}.
     */
    public int distanceTo(HexCoordinate other) {
        return (Math.abs(q - other.q) + Math.abs(r - other.r) + Math.abs(s - other.s)) / 2;
    }

    public static int distance(HexCoordinate a, HexCoordinate b) {
        return a.distanceTo(b);
    }

    /**
     * Returns the adjacent coordinate in the given direction.
     * Directions run clockwise from the upper-right neighbor: 0 = (+1,-1,0) ... 5 = (0,-1,+1).
     * The result is unbound.
     *
     * @param direction 0..5
     * @throws IllegalArgumentException if direction is outside 0..5
     */
    public HexCoordinate neighbor(int direction) {
        if (direction < 0 || direction >= DIRECTIONS.length) {
            throw new IllegalArgumentException("Direction must be in 0..5, got " + direction);
        }
        int[] d = DIRECTIONS[direction];
        return new HexCoordinate(q + d[0], r + d[1], s + d[2]);
    }

    /**
     * @return all six neighbors in direction order
     */
    public List<HexCoordinate> neighbors() {
        List<HexCoordinate> result = new ArrayList<>(DIRECTIONS.length);
        for (int dir = 0; dir < DIRECTIONS.length; dir++) {
            result.add(neighbor(dir));
        }
        return result;
    }

    public HexCoordinate add(HexCoordinate other) {
        return new HexCoordinate(q + other.q, r + other.r, s + other.s);
    }

    public HexCoordinate subtract(HexCoordinate other) {
        return new HexCoordinate(q - other.q, r - other.r, s - other.s);
    }

    public HexCoordinate scale(int factor) {
        return new HexCoordinate(q * factor, r * factor, s * factor);
    }

    /**
     * Canonical string key {@code "q,r,s"}.
     */
    public String key() {
        return q + "," + r + "," + s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HexCoordinate)) return false;
        HexCoordinate other = (HexCoordinate) o;
        return q == other.q && r == other.r && s == other.s;
    }

    @Override
    public int hashCode() {
        return 31 * q + r;
    }

    @Override
    public String toString() {
        return id == UNBOUND_ID ? "Hex(" + key() + ")" : "Hex#" + id + "(" + key() + ")";
    }
}
