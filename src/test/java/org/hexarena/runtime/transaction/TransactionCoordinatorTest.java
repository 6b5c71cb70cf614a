package org.hexarena.runtime.transaction;

import java.util.List;

import org.hexarena.runtime.model.ArenaMap;
import org.hexarena.runtime.model.BoardLayout;
import org.hexarena.runtime.model.GridSnapshot;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.TileState;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.pathfinding.IPathfindingCache;
import org.hexarena.runtime.pathfinding.PathfindingEngine;
import org.hexarena.runtime.skill.SkillEngine;
import org.hexarena.runtime.skill.SkillRegistry;
import org.hexarena.runtime.spi.SeededRandomProvider;
import org.hexarena.runtime.targeting.TargetResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link TransactionCoordinator}: all-or-nothing operations, cascades through
 * companions, nested transactions and the once-per-transaction cache invalidation.
 */
@Tag("unit")
class TransactionCoordinatorTest {

    private static final ArenaMap OPEN = ArenaMap.of("open",
        new int[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 12, 13, 16},
        new int[]{30, 33, 34, 36, 37, 38, 39, 40, 41, 42, 43, 44, 45},
        new int[0]);

    /** Roomy ally side, two enemy tiles. */
    private static final ArenaMap LOPSIDED = ArenaMap.of("lopsided",
        new int[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10},
        new int[]{44, 45},
        new int[0]);

    private static final String SKILLS = """
        skills = [
          { unit = 46, kind = targeting, targets = [{ method = furthest }] }
          { unit = 50, kind = companion, companions = 1 }
          { unit = 89, kind = companion, companions = 2, companion-range = 3 }
          {
            unit = 80, kind = demolition-zone
            zones.ally { blocked = [18, 19, 20, 21, 22, 24], breakable = [23] }
          }
        ]
        """;

    /** Ally side reaching into the middle of the board, where the demolition zone lies. */
    private static final ArenaMap ZONED = ArenaMap.of("zoned",
        new int[]{1, 2, 3, 4, 5, 18, 19, 20, 21, 22, 23, 24},
        new int[]{40, 41, 42, 43, 44, 45},
        new int[0]);

    private static final UnitId VALA = UnitId.main(46);
    private static final UnitId PHRAESTO = UnitId.main(50);
    private static final UnitId TALENE = UnitId.main(52);
    private static final UnitId DUNLINGR = UnitId.main(57);
    private static final UnitId KULU = UnitId.main(80);

    private SpatialGrid grid;
    private IPathfindingCache cache;
    private SkillEngine skills;

    private TransactionCoordinator coordinator(ArenaMap arena) {
        grid = new SpatialGrid(BoardLayout.standard(), arena, 5);
        cache = mock(IPathfindingCache.class);
        PathfindingEngine pathfinding = new PathfindingEngine(grid, cache);
        TargetResolver resolver = new TargetResolver(grid, pathfinding, unit -> 1);
        SkillRegistry registry = SkillRegistry.fromConfig(ConfigFactory.parseString(SKILLS).getConfigList("skills"));
        SeededRandomProvider random = new SeededRandomProvider(42);
        skills = new SkillEngine(registry, resolver, random);
        return new TransactionCoordinator(grid, pathfinding, skills, random);
    }

    // ==================== Place & Remove ====================

    @Test
    void place_shouldPlaceUnitActivateSkillAndInvalidateOnce() {
        TransactionCoordinator tx = coordinator(OPEN);

        assertThat(tx.place(9, VALA, Team.ALLY)).isTrue();

        assertThat(grid.getTileById(9).getOccupant()).isEqualTo(VALA);
        assertThat(skills.isActive(VALA, Team.ALLY)).isTrue();
        verify(cache, times(1)).invalidate();
    }

    @Test
    @DisplayName("placing onto an occupied tile replaces the occupant inside one transaction")
    void place_onOccupiedTileShouldReplaceOccupantWithCascade() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(1, PHRAESTO, Team.ALLY);
        assertThat(grid.getTeamSize(Team.ALLY)).isEqualTo(2);

        assertThat(tx.place(1, VALA, Team.ALLY)).isTrue();

        assertThat(grid.getTeamUnits(Team.ALLY)).containsExactly(VALA);
        assertThat(grid.getMaxTeamSize(Team.ALLY)).isEqualTo(5);
        assertThat(skills.isActive(PHRAESTO, Team.ALLY)).isFalse();
        verify(cache, times(2)).invalidate();
    }

    @Test
    void place_shouldRejectCompanionsAndInvalidTiles() {
        TransactionCoordinator tx = coordinator(OPEN);
        GridSnapshot before = grid.snapshot();

        assertThat(tx.place(1, UnitId.companion(50, 1), Team.ALLY)).isFalse();
        assertThat(tx.place(40, VALA, Team.ALLY)).isFalse();

        assertThat(grid.snapshot()).isEqualTo(before);
    }

    @Test
    void place_failedSkillActivationShouldRollBackPlacement() {
        TransactionCoordinator tx = coordinator(ArenaMap.of("cramped", new int[]{1, 2}, new int[]{45}, new int[0]));
        GridSnapshot before = grid.snapshot();

        assertThat(tx.place(1, UnitId.main(89), Team.ALLY)).isFalse();

        assertThat(grid.snapshot()).isEqualTo(before);
        assertThat(skills.getActiveStates()).isEmpty();
    }

    @Test
    void remove_companionShouldRemoveMainUnitAndAllCompanions() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(9, VALA, Team.ALLY);
        tx.place(1, PHRAESTO, Team.ALLY);
        int companionTile = grid.findUnitTile(UnitId.companion(50, 1), Team.ALLY);

        assertThat(tx.remove(companionTile)).isTrue();

        assertThat(grid.getTeamUnits(Team.ALLY)).containsExactly(VALA);
        assertThat(grid.getMaxTeamSize(Team.ALLY)).isEqualTo(5);
    }

    @Test
    void remove_emptyTileShouldSucceed() {
        TransactionCoordinator tx = coordinator(OPEN);

        assertThat(tx.remove(5)).isTrue();
    }

    // ==================== Move & Swap ====================

    @Test
    void move_withinTeamShouldKeepSkillActive() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(9, VALA, Team.ALLY);

        assertThat(tx.move(9, 1, VALA)).isTrue();

        assertThat(grid.findUnitTile(VALA, Team.ALLY)).isEqualTo(1);
        assertThat(skills.getState(VALA, Team.ALLY).getTileId()).isEqualTo(1);
    }

    @Test
    void move_acrossZonesShouldChangeTeamAndRekeySkill() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(9, VALA, Team.ALLY);

        assertThat(tx.move(9, 40, VALA)).isTrue();

        assertThat(grid.getTileById(40).getOccupantTeam()).isEqualTo(Team.ENEMY);
        assertThat(skills.isActive(VALA, Team.ALLY)).isFalse();
        assertThat(skills.isActive(VALA, Team.ENEMY)).isTrue();
    }

    @Test
    void move_shouldRejectInvalidRequests() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(9, VALA, Team.ALLY);
        tx.place(16, TALENE, Team.ALLY);
        tx.place(1, PHRAESTO, Team.ALLY);
        UnitId companion = UnitId.companion(50, 1);
        int companionTile = grid.findUnitTile(companion, Team.ALLY);
        GridSnapshot before = grid.snapshot();

        assertThat(tx.move(9, 16, VALA)).as("occupied destination").isFalse();
        assertThat(tx.move(9, 20, VALA)).as("neutral destination").isFalse();
        assertThat(tx.move(16, 2, VALA)).as("wrong unit").isFalse();
        assertThat(tx.move(9, 9, VALA)).as("same tile").isFalse();
        assertThat(tx.move(companionTile, 45, companion)).as("companion changing team").isFalse();

        assertThat(grid.snapshot()).isEqualTo(before);
    }

    @Test
    @DisplayName("a failed cross-team move restores the unit, its skill and its companions' tiles")
    void move_failedActivationShouldRestoreCompanionTiles() {
        TransactionCoordinator tx = coordinator(LOPSIDED);
        tx.place(1, PHRAESTO, Team.ALLY);
        tx.place(44, DUNLINGR, Team.ENEMY);
        GridSnapshot before = grid.snapshot();

        assertThat(tx.move(1, 45, PHRAESTO)).isFalse();

        assertThat(grid.snapshot()).isEqualTo(before);
        assertThat(skills.isActive(PHRAESTO, Team.ALLY)).isTrue();
    }

    @Test
    @DisplayName("a rolled-back deactivation puts companions back without consuming random draws")
    void move_failedActivationShouldLeaveRandomStreamUntouched() {
        TransactionCoordinator twin = coordinator(LOPSIDED);
        twin.place(1, PHRAESTO, Team.ALLY);
        twin.place(44, DUNLINGR, Team.ENEMY);
        assertThat(twin.autoPlace(VALA, Team.ALLY)).isTrue();
        int expectedTile = grid.findUnitTile(VALA, Team.ALLY);

        TransactionCoordinator tx = coordinator(LOPSIDED);
        tx.place(1, PHRAESTO, Team.ALLY);
        tx.place(44, DUNLINGR, Team.ENEMY);
        assertThat(tx.move(1, 45, PHRAESTO)).isFalse();
        assertThat(tx.autoPlace(VALA, Team.ALLY)).isTrue();

        assertThat(grid.findUnitTile(VALA, Team.ALLY)).isEqualTo(expectedTile);
    }

    @Test
    void execute_failedRollbackShouldBeReported() {
        TransactionCoordinator tx = coordinator(OPEN);
        TransactionStep brokenUndo = new TransactionStep("broken undo", () -> true, () -> {
            throw new IllegalArgumentException("cannot undo");
        });

        assertThatThrownBy(() -> tx.execute(brokenUndo, TransactionStep.of("fail", () -> false)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("broken undo")
            .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }

    // ==================== Claimed Tiles ====================

    @Test
    @DisplayName("a demolition zone removes the units on it and blocks its tiles until its owner leaves")
    void place_demolitionZoneShouldClearAndBlockItsTiles() {
        TransactionCoordinator tx = coordinator(ZONED);
        tx.place(20, VALA, Team.ALLY);
        tx.place(2, TALENE, Team.ALLY);

        assertThat(tx.place(5, KULU, Team.ALLY)).isTrue();

        assertThat(grid.getTeamUnits(Team.ALLY)).containsExactlyInAnyOrder(TALENE, KULU);
        assertThat(skills.isActive(VALA, Team.ALLY)).isFalse();
        assertThat(grid.getTileById(20).getState()).isEqualTo(TileState.BLOCKED);
        assertThat(grid.getTileById(23).getState()).isEqualTo(TileState.BLOCKED_BREAKABLE);
        assertThat(tx.place(21, VALA, Team.ALLY)).isFalse();

        assertThat(tx.remove(5)).isTrue();

        for (int tileId : new int[]{18, 19, 20, 21, 22, 23, 24}) {
            assertThat(grid.getTileById(tileId).getState()).isEqualTo(TileState.AVAILABLE_ALLY);
        }
    }

    @Test
    void place_onClaimedTileShouldRedirectOutsideTheZone() {
        TransactionCoordinator tx = coordinator(ZONED);

        assertThat(tx.place(23, KULU, Team.ALLY)).isTrue();

        int kuluTile = grid.findUnitTile(KULU, Team.ALLY);
        assertThat(kuluTile).isIn(1, 2, 3, 4, 5);
        assertThat(grid.getTileById(23).getState()).isEqualTo(TileState.BLOCKED_BREAKABLE);
        assertThat(skills.getState(KULU, Team.ALLY).getTileId()).isEqualTo(kuluTile);
    }

    @Test
    void place_onClaimedTileWithoutRoomOutsideShouldFail() {
        TransactionCoordinator tx = coordinator(ArenaMap.of("zone only",
            new int[]{18, 19, 20, 21, 22, 23, 24}, new int[]{45}, new int[0]));
        GridSnapshot before = grid.snapshot();

        assertThat(tx.place(23, KULU, Team.ALLY)).isFalse();

        assertThat(grid.snapshot()).isEqualTo(before);
        assertThat(skills.getActiveStates()).isEmpty();
    }

    @Test
    void autoPlace_shouldNeverDrawAClaimedTile() {
        TransactionCoordinator tx = coordinator(ZONED);

        assertThat(tx.autoPlace(KULU, Team.ALLY)).isTrue();

        assertThat(grid.findUnitTile(KULU, Team.ALLY)).isIn(1, 2, 3, 4, 5);
    }

    @Test
    void swap_twiceShouldRestoreTheBoard() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(9, VALA, Team.ALLY);
        tx.place(2, TALENE, Team.ALLY);
        tx.place(40, DUNLINGR, Team.ENEMY);
        GridSnapshot before = grid.snapshot();

        assertThat(tx.swap(9, 40)).isTrue();
        assertThat(grid.getTileById(40).getOccupant()).isEqualTo(VALA);
        assertThat(skills.isActive(VALA, Team.ENEMY)).isTrue();

        assertThat(tx.swap(9, 40)).isTrue();
        assertThat(grid.snapshot()).isEqualTo(before);
        assertThat(skills.isActive(VALA, Team.ALLY)).isTrue();
    }

    @Test
    void swap_shouldRejectDuplicatesCompanionsAndEmptyTiles() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(1, VALA, Team.ALLY);
        tx.place(45, VALA, Team.ENEMY);
        tx.place(44, TALENE, Team.ENEMY);
        tx.place(9, PHRAESTO, Team.ALLY);
        int companionTile = grid.findUnitTile(UnitId.companion(50, 1), Team.ALLY);

        assertThat(tx.swap(1, 44)).as("duplicate on enemy team").isFalse();
        assertThat(tx.swap(companionTile, 44)).as("companion across teams").isFalse();
        assertThat(tx.swap(1, 20)).as("empty tile").isFalse();
        assertThat(tx.swap(1, companionTile)).as("same team with companion").isTrue();
    }

    // ==================== Nesting ====================

    @Test
    void execute_outerFailureShouldRollBackNestedOperations() {
        TransactionCoordinator tx = coordinator(OPEN);
        GridSnapshot before = grid.snapshot();

        boolean result = tx.execute(
            TransactionStep.of("place vala", () -> tx.place(9, VALA, Team.ALLY)),
            TransactionStep.of("place phraesto", () -> tx.place(1, PHRAESTO, Team.ALLY)),
            TransactionStep.of("fail", () -> false));

        assertThat(result).isFalse();
        assertThat(grid.snapshot()).isEqualTo(before);
        assertThat(skills.getActiveStates()).isEmpty();
        verify(cache, times(1)).invalidate();
    }

    @Test
    void execute_exceptionShouldRollBackAndPropagate() {
        TransactionCoordinator tx = coordinator(OPEN);
        GridSnapshot before = grid.snapshot();

        assertThatThrownBy(() -> tx.execute(List.of(
            TransactionStep.of("place", () -> tx.place(9, VALA, Team.ALLY)),
            TransactionStep.of("boom", () -> {
                throw new IllegalStateException("boom");
            }))))
            .isInstanceOf(IllegalStateException.class);

        assertThat(grid.snapshot()).isEqualTo(before);
        verify(cache, times(1)).invalidate();
    }

    // ==================== Board Operations ====================

    @Test
    void paintTile_shouldEvictOccupantAndRejectOccupiedStates() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(1, PHRAESTO, Team.ALLY);

        assertThat(tx.paintTile(1, TileState.OCCUPIED_ALLY)).isFalse();
        assertThat(tx.paintTile(1, TileState.BLOCKED_BREAKABLE)).isTrue();

        assertThat(grid.getTileById(1).getState()).isEqualTo(TileState.BLOCKED_BREAKABLE);
        assertThat(grid.getTeamUnits(Team.ALLY)).isEmpty();
        assertThat(skills.getActiveStates()).isEmpty();
    }

    @Test
    void setMaxTeamSize_shouldRespectPlacedUnits() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(1, VALA, Team.ALLY);
        tx.place(2, TALENE, Team.ALLY);

        assertThat(tx.setMaxTeamSize(Team.ALLY, 1)).isFalse();
        assertThat(tx.setMaxTeamSize(Team.ALLY, 2)).isTrue();
        assertThat(tx.place(3, DUNLINGR, Team.ALLY)).isFalse();
    }

    @Test
    void autoPlace_shouldFillFreeTilesUntilTeamIsFull() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.setMaxTeamSize(Team.ENEMY, 2);

        assertThat(tx.autoPlace(TALENE, Team.ENEMY)).isTrue();
        assertThat(tx.autoPlace(TALENE, Team.ENEMY)).as("already placed").isFalse();
        assertThat(tx.autoPlace(DUNLINGR, Team.ENEMY)).isTrue();
        assertThat(tx.autoPlace(VALA, Team.ENEMY)).as("team full").isFalse();
        assertThat(grid.getTeamUnits(Team.ENEMY)).containsExactly(TALENE, DUNLINGR);
    }

    @Test
    void flipAndReset_shouldDeactivateEverySkill() {
        TransactionCoordinator tx = coordinator(OPEN);
        tx.place(1, PHRAESTO, Team.ALLY);

        assertThat(tx.flipArena()).isTrue();
        assertThat(skills.getActiveStates()).isEmpty();
        assertThat(grid.getMaxTeamSize(Team.ALLY)).isEqualTo(5);
        assertThat(grid.getTileById(1).getState()).isEqualTo(TileState.AVAILABLE_ENEMY);

        tx.place(9, VALA, Team.ENEMY);
        assertThat(tx.resetToArena(OPEN)).isTrue();
        assertThat(grid.getOccupiedTiles()).isEmpty();
        assertThat(skills.getActiveStates()).isEmpty();
        assertThat(grid.getTileById(1).getState()).isEqualTo(TileState.AVAILABLE_ALLY);
    }
}
