package org.hexarena.runtime.model;

import java.util.Arrays;
import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Static geometry of a board preset: which coordinates exist and which board-position id each
 * one carries, plus the two derived position classes used by targeting.
 * <p>
 * A preset is described row by row. Each row lists tile ids left to right and the q coordinate of
 * its first tile; r is the row index minus the index of the center row.
 * <p>
 * <strong>Diagonal rows:</strong> tiles with equal {@code q - r} form a diagonal row. Rows are
 * numbered from 1 starting at the ALLY back edge (smallest {@code q - r}); the diagonal
 * {@code q == r} through the board center is the middle row.
 * <p>
 * <strong>Mirror tiles:</strong> the reflection of {@code (q, r)} across the middle diagonal is
 * {@code (r, q)}. Tiles on the middle diagonal mirror to themselves.
 * <p>
 * Instances are immutable.
 */
public final class BoardLayout {

    private static final int[][] STANDARD_ROWS = {
        {43, 45},
        {35, 38, 40, 42, 44},
        {28, 31, 34, 37, 39, 41},
        {21, 24, 27, 30, 33, 36},
        {14, 17, 20, 23, 26, 29, 32},
        {10, 13, 16, 19, 22, 25},
        {5, 7, 9, 12, 15, 18},
        {2, 4, 6, 8, 11},
        {1, 3}
    };

    private static final int[] STANDARD_Q_OFFSETS = {2, 0, -1, -2, -3, -3, -4, -4, -3};

    private static final BoardLayout STANDARD = new BoardLayout(STANDARD_ROWS, STANDARD_Q_OFFSETS);

    private final Int2ObjectOpenHashMap<HexCoordinate> coordinatesById = new Int2ObjectOpenHashMap<>();
    private final Object2IntOpenHashMap<HexCoordinate> idsByCoordinate = new Object2IntOpenHashMap<>();
    private final Int2IntOpenHashMap diagonalRowById = new Int2IntOpenHashMap();
    private final Int2IntOpenHashMap mirrorById = new Int2IntOpenHashMap();
    private final int[] sortedIds;
    private final int middleDiagonalRow;

    /**
     * Builds a layout from rows of tile ids.
     *
     * @param rows     tile ids per row, top row first
     * @param qOffsets q coordinate of the first tile in each row
     * @throws IllegalArgumentException if the arrays disagree in length, or an id repeats
     */
    public BoardLayout(int[][] rows, int[] qOffsets) {
        if (rows.length != qOffsets.length) {
            throw new IllegalArgumentException("Expected one q offset per row: " + rows.length + " rows, " + qOffsets.length + " offsets");
        }
        idsByCoordinate.defaultReturnValue(-1);
        diagonalRowById.defaultReturnValue(-1);
        mirrorById.defaultReturnValue(-1);

        int centerRow = rows.length / 2;
        for (int rowIndex = 0; rowIndex < rows.length; rowIndex++) {
            int r = rowIndex - centerRow;
            for (int i = 0; i < rows[rowIndex].length; i++) {
                int id = rows[rowIndex][i];
                int q = qOffsets[rowIndex] + i;
                HexCoordinate coord = new HexCoordinate(q, r, -q - r, id);
                if (coordinatesById.put(id, coord) != null) {
                    throw new IllegalArgumentException("Duplicate tile id in layout: " + id);
                }
                idsByCoordinate.put(coord, id);
            }
        }

        this.sortedIds = coordinatesById.keySet().toIntArray();
        Arrays.sort(sortedIds);

        int minDiff = Integer.MAX_VALUE;
        for (HexCoordinate coord : coordinatesById.values()) {
            minDiff = Math.min(minDiff, coord.getQ() - coord.getR());
        }
        this.middleDiagonalRow = -minDiff + 1;

        for (HexCoordinate coord : coordinatesById.values()) {
            diagonalRowById.put(coord.getId(), coord.getQ() - coord.getR() - minDiff + 1);
            int mirrorId = idsByCoordinate.getInt(HexCoordinate.fromAxial(coord.getR(), coord.getQ()));
            mirrorById.put(coord.getId(), mirrorId);
        }
    }

    /**
     * @return the 45-tile preset used by every standard arena
     */
    public static BoardLayout standard() {
        return STANDARD;
    }

    public int size() {
        return sortedIds.length;
    }

    /**
     * @return all tile ids in ascending order (a fresh copy)
     */
    public int[] tileIds() {
        return sortedIds.clone();
    }

    public boolean contains(int tileId) {
        return coordinatesById.containsKey(tileId);
    }

    /**
     * @return the bound coordinate of the tile, or {@code null} if the id is not on this board
     */
    public HexCoordinate coordinateOf(int tileId) {
        return coordinatesById.get(tileId);
    }

    /**
     * @return the board id at the given position, or -1 if the position is off the board
     */
    public int idOf(HexCoordinate coordinate) {
        return idsByCoordinate.getInt(coordinate);
    }

    /**
     * @return the bound coordinate equal to the given one, or {@code null} if it is off the board
     */
    public HexCoordinate bind(HexCoordinate coordinate) {
        int id = idOf(coordinate);
        return id < 0 ? null : coordinatesById.get(id);
    }

    /**
     * @return the 1-based diagonal row of the tile, or -1 if the id is not on this board
     */
    public int diagonalRow(int tileId) {
        return diagonalRowById.get(tileId);
    }

    public int middleDiagonalRow() {
        return middleDiagonalRow;
    }

    public boolean sameDiagonalRow(int tileA, int tileB) {
        int rowA = diagonalRow(tileA);
        return rowA != -1 && rowA == diagonalRow(tileB);
    }

    /**
     * @return the id of the mirrored tile, or -1 if the mirror position is off the board
     */
    public int mirrorOf(int tileId) {
        return mirrorById.get(tileId);
    }

    /**
     * @return ids grouped by diagonal row, row 1 first, ids ascending within a row
     */
    public List<int[]> diagonalRows() {
        int rowCount = 0;
        for (int id : sortedIds) {
            rowCount = Math.max(rowCount, diagonalRow(id));
        }
        int[][] rows = new int[rowCount][];
        int[] sizes = new int[rowCount];
        for (int id : sortedIds) {
            sizes[diagonalRow(id) - 1]++;
        }
        for (int i = 0; i < rowCount; i++) {
            rows[i] = new int[sizes[i]];
            sizes[i] = 0;
        }
        for (int id : sortedIds) {
            int row = diagonalRow(id) - 1;
            rows[row][sizes[row]++] = id;
        }
        return List.of(rows);
    }
}
