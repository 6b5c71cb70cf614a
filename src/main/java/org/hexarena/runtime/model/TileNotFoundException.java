package org.hexarena.runtime.model;

/**
 * Thrown when a tile id or coordinate lies outside the board preset.
 */
public class TileNotFoundException extends IllegalArgumentException {

    public TileNotFoundException(int tileId) {
        super("No tile with id " + tileId + " on this board");
    }

    public TileNotFoundException(HexCoordinate coordinate) {
        super("No tile at " + coordinate.key() + " on this board");
    }
}
