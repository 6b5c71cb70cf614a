package org.hexarena.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.hexarena.runtime.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Tile storage and team bookkeeping for one board.
 * <p>
 * The grid exclusively owns tile state, team membership, team capacity and companion links.
 * Every mutation bumps {@link #getModificationCount()}, which callers use as a cheap board-state
 * fingerprint for cache keys.
 * <p>
 * Invariant: a unit is in a team's membership set if and only if exactly one tile of that team
 * has it as occupant.
 * <p>
 * Placement rejections are expected conditions and are reported as {@code false}; ids and
 * coordinates outside the board are programmer errors and throw {@link TileNotFoundException}.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. The grid is mutated only through the
 * transaction coordinator on a single thread.
 */
public class SpatialGrid {

    private static final Logger LOG = LoggerFactory.getLogger(SpatialGrid.class);

    private final BoardLayout layout;
    private final Int2ObjectOpenHashMap<Tile> tiles = new Int2ObjectOpenHashMap<>();
    private final int[] sortedIds;
    private final EnumMap<Team, Set<UnitId>> teamUnits = new EnumMap<>(Team.class);
    private final EnumMap<Team, Integer> maxTeamSizes = new EnumMap<>(Team.class);
    private final Map<TeamUnit, Set<UnitId>> companionLinks = new HashMap<>();
    private ArenaMap arena;
    private long modificationCount;

    /**
     * Creates a grid with the default team capacity.
     */
    public SpatialGrid(BoardLayout layout, ArenaMap arena) {
        this(layout, arena, Config.DEFAULT_MAX_TEAM_SIZE);
    }

    /**
     * Creates a grid laid out by {@code layout} with the initial states of {@code arena}.
     *
     * @param defaultMaxTeamSize initial capacity of both teams
     * @throws IllegalArgumentException if the capacity is not in 1..tile count
     */
    public SpatialGrid(BoardLayout layout, ArenaMap arena, int defaultMaxTeamSize) {
        if (defaultMaxTeamSize < 1 || defaultMaxTeamSize > layout.size()) {
            throw new IllegalArgumentException("Team size must be in 1.." + layout.size() + ", got " + defaultMaxTeamSize);
        }
        this.layout = layout;
        this.sortedIds = layout.tileIds();
        for (int id : sortedIds) {
            tiles.put(id, new Tile(layout.coordinateOf(id), TileState.DEFAULT));
        }
        for (Team team : Team.values()) {
            teamUnits.put(team, new LinkedHashSet<>());
            maxTeamSizes.put(team, defaultMaxTeamSize);
        }
        applyArena(arena);
    }

    // ==================== Tile Lookup ====================

    public BoardLayout getLayout() {
        return layout;
    }

    public ArenaMap getArena() {
        return arena;
    }

    /**
     * @throws TileNotFoundException if the coordinate is not on this board
     */
    public Tile getTile(HexCoordinate coordinate) {
        Tile tile = findTile(coordinate);
        if (tile == null) {
            throw new TileNotFoundException(coordinate);
        }
        return tile;
    }

    /**
     * @return the tile at the coordinate, or {@code null} if it is off the board
     */
    public Tile findTile(HexCoordinate coordinate) {
        int id = coordinate.isBound() ? coordinate.getId() : layout.idOf(coordinate);
        return id < 0 ? null : tiles.get(id);
    }

    /**
     * @throws TileNotFoundException if the id is not on this board
     */
    public Tile getTileById(int tileId) {
        Tile tile = tiles.get(tileId);
        if (tile == null) {
            throw new TileNotFoundException(tileId);
        }
        return tile;
    }

    public int getTileCount() {
        return sortedIds.length;
    }

    /**
     * @return all tiles ascending by id
     */
    public List<Tile> getAllTiles() {
        List<Tile> result = new ArrayList<>(sortedIds.length);
        for (int id : sortedIds) {
            result.add(tiles.get(id));
        }
        return result;
    }

    /**
     * @return occupied tiles ascending by id
     */
    public List<Tile> getOccupiedTiles() {
        List<Tile> result = new ArrayList<>();
        for (int id : sortedIds) {
            Tile tile = tiles.get(id);
            if (tile.isOccupied()) {
                result.add(tile);
            }
        }
        return result;
    }

    /**
     * @return empty tiles the team may place on, ascending by id
     */
    public List<Tile> getAvailableTiles(Team team) {
        List<Tile> result = new ArrayList<>();
        for (int id : sortedIds) {
            Tile tile = tiles.get(id);
            if (tile.getState() == team.availableState()) {
                result.add(tile);
            }
        }
        return result;
    }

    /**
     * True if the tile is Available or Occupied for the team, i.e. a unit of that team could stand there.
     */
    public boolean canHost(int tileId, Team team) {
        Tile tile = tiles.get(tileId);
        return tile != null && tile.belongsTo(team);
    }

    // ==================== Occupancy State ====================

    /**
     * Paints a tile with the state for the given code.
     *
     * @return {@code false} without mutation if the code is out of range
     * @see #setOccupancyState(HexCoordinate, TileState)
     */
    public boolean setOccupancyState(HexCoordinate coordinate, int stateCode) {
        TileState state = TileState.fromCode(stateCode);
        if (state == null) {
            LOG.debug("Rejected state code {} for {}", stateCode, coordinate);
            return false;
        }
        return setOccupancyState(coordinate, state);
    }

    /**
     * Paints a tile.
     * <p>
     * Occupied states can only be produced by placing a unit, so painting one is accepted only as a
     * no-op on a tile already occupied by that team. Any other state overwrites the tile and evicts
     * a current occupant from its team; companion links and skills are the caller's concern.
     *
     * @return {@code true} if the tile now has the requested state
     * @throws TileNotFoundException if the coordinate is not on this board
     */
    public boolean setOccupancyState(HexCoordinate coordinate, TileState state) {
        Tile tile = getTile(coordinate);
        if (state == null) {
            return false;
        }
        if (state.isOccupied()) {
            return tile.getState() == state;
        }
        if (tile.isOccupied()) {
            teamUnits.get(tile.getOccupantTeam()).remove(tile.getOccupant());
            tile.vacate();
        }
        tile.setState(state);
        modificationCount++;
        return true;
    }

    // ==================== Units ====================

    /**
     * Checks whether {@link #placeUnit} would succeed.
     */
    public boolean canPlace(int tileId, UnitId unit, Team team) {
        Tile tile = tiles.get(tileId);
        if (tile == null || tile.isOccupied() || tile.getState() != team.availableState()) {
            return false;
        }
        Set<UnitId> members = teamUnits.get(team);
        return !members.contains(unit) && members.size() < maxTeamSizes.get(team);
    }

    /**
     * Places a unit on an empty tile of its team.
     *
     * @return {@code false} if the tile cannot host the team, the unit is already on that team,
     *         or the team is at capacity
     */
    public boolean placeUnit(int tileId, UnitId unit, Team team) {
        if (!canPlace(tileId, unit, team)) {
            LOG.debug("Rejected placement of {} for {} on tile {}", unit, team, tileId);
            return false;
        }
        tiles.get(tileId).occupy(unit, team);
        teamUnits.get(team).add(unit);
        modificationCount++;
        return true;
    }

    /**
     * Clears the occupant of a tile, reverting it to Available for the occupant's team.
     *
     * @return {@code false} if the tile is empty
     * @throws TileNotFoundException if the id is not on this board
     */
    public boolean removeUnit(int tileId) {
        Tile tile = getTileById(tileId);
        if (!tile.isOccupied()) {
            return false;
        }
        teamUnits.get(tile.getOccupantTeam()).remove(tile.getOccupant());
        tile.vacate();
        modificationCount++;
        return true;
    }

    /**
     * @return the placed units of the team in placement order (read-only view)
     */
    public Set<UnitId> getTeamUnits(Team team) {
        return Collections.unmodifiableSet(teamUnits.get(team));
    }

    public int getTeamSize(Team team) {
        return teamUnits.get(team).size();
    }

    public boolean hasUnit(UnitId unit, Team team) {
        return teamUnits.get(team).contains(unit);
    }

    /**
     * @return the tile id holding the unit for the team, or -1 if it is not placed
     */
    public int findUnitTile(UnitId unit, Team team) {
        if (!teamUnits.get(team).contains(unit)) {
            return -1;
        }
        for (int id : sortedIds) {
            Tile tile = tiles.get(id);
            if (unit.equals(tile.getOccupant()) && tile.getOccupantTeam() == team) {
                return id;
            }
        }
        return -1;
    }

    // ==================== Capacity ====================

    public int getMaxTeamSize(Team team) {
        return maxTeamSizes.get(team);
    }

    public boolean isTeamFull(Team team) {
        return teamUnits.get(team).size() >= maxTeamSizes.get(team);
    }

    /**
     * Sets a team's capacity.
     *
     * @return {@code false} without mutation if the size is below the current unit count (or 1)
     *         or above the tile count
     */
    public boolean setMaxTeamSize(Team team, int size) {
        int floor = Math.max(1, teamUnits.get(team).size());
        if (size < floor || size > sortedIds.length) {
            LOG.debug("Rejected team size {} for {} (allowed {}..{})", size, team, floor, sortedIds.length);
            return false;
        }
        if (maxTeamSizes.get(team) != size) {
            maxTeamSizes.put(team, size);
            modificationCount++;
        }
        return true;
    }

    /**
     * Raises or lowers a team's capacity by {@code delta} under the same bounds as {@link #setMaxTeamSize}.
     */
    public boolean adjustMaxTeamSize(Team team, int delta) {
        return setMaxTeamSize(team, maxTeamSizes.get(team) + delta);
    }

    // ==================== Companion Links ====================

    public void addCompanionLink(UnitId main, Team team, UnitId companion) {
        companionLinks.computeIfAbsent(new TeamUnit(main, team), k -> new LinkedHashSet<>()).add(companion);
        modificationCount++;
    }

    public boolean removeCompanionLink(UnitId main, Team team, UnitId companion) {
        TeamUnit key = new TeamUnit(main, team);
        Set<UnitId> links = companionLinks.get(key);
        if (links == null || !links.remove(companion)) {
            return false;
        }
        if (links.isEmpty()) {
            companionLinks.remove(key);
        }
        modificationCount++;
        return true;
    }

    public void clearCompanionLinks(UnitId main, Team team) {
        if (companionLinks.remove(new TeamUnit(main, team)) != null) {
            modificationCount++;
        }
    }

    /**
     * @return a copy of the companions linked to the unit, in spawn order
     */
    public Set<UnitId> getCompanions(UnitId main, Team team) {
        Set<UnitId> links = companionLinks.get(new TeamUnit(main, team));
        return links == null ? Set.of() : new LinkedHashSet<>(links);
    }

    // ==================== Bulk Operations ====================

    /**
     * Removes every unit and companion link. Tile states revert to Available and capacities are kept.
     */
    public void clearAllUnits() {
        for (Tile tile : tiles.values()) {
            tile.vacate();
        }
        for (Set<UnitId> members : teamUnits.values()) {
            members.clear();
        }
        companionLinks.clear();
        modificationCount++;
    }

    /**
     * Clears all units and lays the given arena's states onto the board.
     */
    public void resetToArena(ArenaMap newArena) {
        clearAllUnits();
        applyArena(newArena);
    }

    /**
     * Clears all units and gives every tile the state of its mirror tile, so the two deployment
     * zones trade sides. Tiles without a mirror keep their state.
     */
    public void flipArena() {
        clearAllUnits();
        Int2ObjectOpenHashMap<TileState> before = new Int2ObjectOpenHashMap<>();
        for (int id : sortedIds) {
            before.put(id, tiles.get(id).getState());
        }
        for (int id : sortedIds) {
            int mirror = layout.mirrorOf(id);
            if (mirror >= 0) {
                tiles.get(id).setState(before.get(mirror));
            }
        }
        modificationCount++;
    }

    private void applyArena(ArenaMap newArena) {
        TileState[] states = newArena.statesFor(layout);
        for (int id : sortedIds) {
            tiles.get(id).setState(states[id]);
        }
        this.arena = newArena;
        modificationCount++;
        LOG.debug("Applied arena {}", newArena.getName());
    }

    // ==================== Fingerprint & Snapshot ====================

    /**
     * @return a counter that increases with every mutation of this grid
     */
    public long getModificationCount() {
        return modificationCount;
    }

    public GridSnapshot snapshot() {
        List<GridSnapshot.TileSnapshot> tileSnapshots = new ArrayList<>(sortedIds.length);
        for (int id : sortedIds) {
            Tile tile = tiles.get(id);
            tileSnapshots.add(new GridSnapshot.TileSnapshot(id, tile.getState(), tile.getOccupant(), tile.getOccupantTeam()));
        }
        Map<Team, Set<UnitId>> units = new EnumMap<>(Team.class);
        teamUnits.forEach((team, members) -> units.put(team, Collections.unmodifiableSet(new TreeSet<>(members))));
        Map<TeamUnit, Set<UnitId>> links = new LinkedHashMap<>();
        companionLinks.forEach((key, companions) -> links.put(key, Collections.unmodifiableSet(new TreeSet<>(companions))));
        return new GridSnapshot(
            List.copyOf(tileSnapshots),
            Collections.unmodifiableMap(new EnumMap<>(maxTeamSizes)),
            Collections.unmodifiableMap(units),
            Collections.unmodifiableMap(links));
    }
}
