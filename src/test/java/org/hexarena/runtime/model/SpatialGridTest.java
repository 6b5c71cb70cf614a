package org.hexarena.runtime.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SpatialGrid}: placement rules, team capacity, companion links and the
 * bulk arena operations.
 */
@Tag("unit")
class SpatialGridTest {

    private static final ArenaMap ARENA = ArenaMap.of("test",
        new int[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10},
        new int[]{36, 37, 38, 39, 40, 41, 42, 43, 44, 45},
        new int[]{23});

    private SpatialGrid grid;

    @BeforeEach
    void setUp() {
        grid = new SpatialGrid(BoardLayout.standard(), ARENA, 3);
    }

    @Test
    void constructor_shouldApplyArenaStates() {
        assertThat(grid.getTileById(1).getState()).isEqualTo(TileState.AVAILABLE_ALLY);
        assertThat(grid.getTileById(45).getState()).isEqualTo(TileState.AVAILABLE_ENEMY);
        assertThat(grid.getTileById(23).getState()).isEqualTo(TileState.BLOCKED);
        assertThat(grid.getTileById(20).getState()).isEqualTo(TileState.DEFAULT);
        assertThat(grid.getAvailableTiles(Team.ALLY)).hasSize(10);
        assertThat(grid.getMaxTeamSize(Team.ENEMY)).isEqualTo(3);
    }

    @Test
    void constructor_shouldRejectCapacityOutsideBoard() {
        assertThatThrownBy(() -> new SpatialGrid(BoardLayout.standard(), ARENA, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpatialGrid(BoardLayout.standard(), ARENA, 46))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void placeUnit_shouldOccupyTileAndJoinTeam() {
        UnitId unit = UnitId.main(46);

        assertThat(grid.placeUnit(9, unit, Team.ALLY)).isTrue();

        Tile tile = grid.getTileById(9);
        assertThat(tile.getState()).isEqualTo(TileState.OCCUPIED_ALLY);
        assertThat(tile.getOccupant()).isEqualTo(unit);
        assertThat(grid.hasUnit(unit, Team.ALLY)).isTrue();
        assertThat(grid.findUnitTile(unit, Team.ALLY)).isEqualTo(9);
        assertThat(grid.findUnitTile(unit, Team.ENEMY)).isEqualTo(-1);
    }

    @Test
    void placeUnit_shouldRejectWrongTeamOccupiedDuplicateAndFullTeam() {
        assertThat(grid.placeUnit(40, UnitId.main(46), Team.ALLY)).as("enemy tile").isFalse();
        assertThat(grid.placeUnit(20, UnitId.main(46), Team.ALLY)).as("neutral tile").isFalse();

        assertThat(grid.placeUnit(1, UnitId.main(46), Team.ALLY)).isTrue();
        assertThat(grid.placeUnit(1, UnitId.main(52), Team.ALLY)).as("occupied").isFalse();
        assertThat(grid.placeUnit(2, UnitId.main(46), Team.ALLY)).as("duplicate").isFalse();

        assertThat(grid.placeUnit(2, UnitId.main(52), Team.ALLY)).isTrue();
        assertThat(grid.placeUnit(3, UnitId.main(57), Team.ALLY)).isTrue();
        assertThat(grid.isTeamFull(Team.ALLY)).isTrue();
        assertThat(grid.placeUnit(4, UnitId.main(58), Team.ALLY)).as("full").isFalse();
        assertThat(grid.getTeamSize(Team.ALLY)).isEqualTo(3);
    }

    @Test
    void placeUnit_shouldAllowSameUnitOnBothTeams() {
        assertThat(grid.placeUnit(1, UnitId.main(46), Team.ALLY)).isTrue();
        assertThat(grid.placeUnit(45, UnitId.main(46), Team.ENEMY)).isTrue();
    }

    @Test
    void removeUnit_shouldRevertTileToAvailable() {
        grid.placeUnit(5, UnitId.main(46), Team.ALLY);

        assertThat(grid.removeUnit(5)).isTrue();
        assertThat(grid.getTileById(5).getState()).isEqualTo(TileState.AVAILABLE_ALLY);
        assertThat(grid.getTeamUnits(Team.ALLY)).isEmpty();
        assertThat(grid.removeUnit(5)).isFalse();
    }

    @Test
    void unknownTileIds_shouldThrowTileNotFound() {
        assertThatThrownBy(() -> grid.getTileById(99)).isInstanceOf(TileNotFoundException.class);
        assertThatThrownBy(() -> grid.removeUnit(0)).isInstanceOf(TileNotFoundException.class);
        assertThat(grid.findTile(HexCoordinate.fromAxial(9, 9))).isNull();
    }

    @Test
    void setMaxTeamSize_shouldNotDropBelowCurrentUnitCount() {
        grid.placeUnit(1, UnitId.main(46), Team.ALLY);
        grid.placeUnit(2, UnitId.main(52), Team.ALLY);

        assertThat(grid.setMaxTeamSize(Team.ALLY, 1)).isFalse();
        assertThat(grid.setMaxTeamSize(Team.ALLY, 46)).isFalse();
        assertThat(grid.setMaxTeamSize(Team.ALLY, 2)).isTrue();
        assertThat(grid.adjustMaxTeamSize(Team.ALLY, 4)).isTrue();
        assertThat(grid.getMaxTeamSize(Team.ALLY)).isEqualTo(6);
    }

    @Test
    void setOccupancyState_shouldEvictOccupantAndRejectOccupiedStates() {
        HexCoordinate nine = BoardLayout.standard().coordinateOf(9);
        grid.placeUnit(9, UnitId.main(46), Team.ALLY);

        assertThat(grid.setOccupancyState(nine, TileState.OCCUPIED_ENEMY)).isFalse();
        assertThat(grid.setOccupancyState(nine, 99)).isFalse();
        assertThat(grid.setOccupancyState(nine, TileState.BLOCKED.getCode())).isTrue();

        assertThat(grid.getTileById(9).getState()).isEqualTo(TileState.BLOCKED);
        assertThat(grid.getTileById(9).isOccupied()).isFalse();
        assertThat(grid.hasUnit(UnitId.main(46), Team.ALLY)).isFalse();
    }

    @Test
    void companionLinks_shouldTrackPerOwnerAndTeam() {
        UnitId main = UnitId.main(50);
        UnitId companion = UnitId.companion(50, 1);

        grid.addCompanionLink(main, Team.ALLY, companion);

        assertThat(grid.getCompanions(main, Team.ALLY)).containsExactly(companion);
        assertThat(grid.getCompanions(main, Team.ENEMY)).isEmpty();
        assertThat(grid.removeCompanionLink(main, Team.ALLY, companion)).isTrue();
        assertThat(grid.removeCompanionLink(main, Team.ALLY, companion)).isFalse();
    }

    @Test
    void flipArena_shouldSwapDeploymentZonesAndClearUnits() {
        grid.placeUnit(1, UnitId.main(46), Team.ALLY);

        grid.flipArena();

        assertThat(grid.getOccupiedTiles()).isEmpty();
        assertThat(grid.getTileById(1).getState()).isEqualTo(TileState.AVAILABLE_ENEMY);
        assertThat(grid.getTileById(44).getState()).isEqualTo(TileState.AVAILABLE_ALLY);
        assertThat(grid.getTileById(23).getState()).isEqualTo(TileState.BLOCKED);
    }

    @Test
    void resetToArena_shouldReplaceStatesButKeepCapacity() {
        grid.placeUnit(1, UnitId.main(46), Team.ALLY);
        ArenaMap other = ArenaMap.of("other", new int[]{20}, new int[]{21}, new int[0]);

        grid.resetToArena(other);

        assertThat(grid.getArena()).isSameAs(other);
        assertThat(grid.getTileById(1).getState()).isEqualTo(TileState.DEFAULT);
        assertThat(grid.getTileById(20).getState()).isEqualTo(TileState.AVAILABLE_ALLY);
        assertThat(grid.getTeamUnits(Team.ALLY)).isEmpty();
        assertThat(grid.getMaxTeamSize(Team.ALLY)).isEqualTo(3);
    }

    @Test
    void modificationCount_shouldGrowWithEveryMutationOnly() {
        long before = grid.getModificationCount();
        grid.canPlace(1, UnitId.main(46), Team.ALLY);
        grid.getOccupiedTiles();
        assertThat(grid.getModificationCount()).isEqualTo(before);

        grid.placeUnit(1, UnitId.main(46), Team.ALLY);
        assertThat(grid.getModificationCount()).isGreaterThan(before);
    }

    @Test
    void snapshot_shouldCompareEqualAfterUndoingChanges() {
        GridSnapshot before = grid.snapshot();

        grid.placeUnit(1, UnitId.main(46), Team.ALLY);
        assertThat(grid.snapshot()).isNotEqualTo(before);

        grid.removeUnit(1);
        assertThat(grid.snapshot()).isEqualTo(before);
    }
}
