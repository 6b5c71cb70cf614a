package org.hexarena.runtime.model;

/**
 * A single board position. Tiles are created once by {@link SpatialGrid} and mutated in place;
 * only the grid may change their state, which keeps the occupant present exactly when the state
 * is an Occupied variant.
 */
public final class Tile {

    private final HexCoordinate coordinate;
    private TileState state;
    private UnitId occupant;
    private Team occupantTeam;

    Tile(HexCoordinate coordinate, TileState state) {
        this.coordinate = coordinate;
        this.state = state;
    }

    public HexCoordinate getCoordinate() {
        return coordinate;
    }

    public int getId() {
        return coordinate.getId();
    }

    public TileState getState() {
        return state;
    }

    /**
     * @return the unit on this tile, or {@code null} if empty
     */
    public UnitId getOccupant() {
        return occupant;
    }

    /**
     * @return the team of the unit on this tile, or {@code null} if empty
     */
    public Team getOccupantTeam() {
        return occupantTeam;
    }

    public boolean isOccupied() {
        return occupant != null;
    }

    /**
     * True if the tile is Available or Occupied for the given team.
     */
    public boolean belongsTo(Team team) {
        return state == team.availableState() || state == team.occupiedState();
    }

    void setState(TileState state) {
        this.state = state;
    }

    void occupy(UnitId unit, Team team) {
        this.occupant = unit;
        this.occupantTeam = team;
        this.state = team.occupiedState();
    }

    void vacate() {
        Team team = occupantTeam;
        this.occupant = null;
        this.occupantTeam = null;
        if (team != null && state == team.occupiedState()) {
            this.state = team.availableState();
        }
    }

    @Override
    public String toString() {
        return "Tile#" + getId() + "[" + state + (occupant != null ? ", " + occupant : "") + "]";
    }
}
