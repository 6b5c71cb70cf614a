package org.hexarena.runtime;

import java.util.Map;

import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.TileState;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.targeting.IRangeProvider;
import org.hexarena.runtime.targeting.TargetInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wiring tests for {@link Battlefield} built from the bundled {@code reference.conf}.
 */
@Tag("unit")
class BattlefieldTest {

    private Battlefield battlefield;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
        battlefield = Battlefield.fromConfig(ConfigFactory.load());
    }

    @Test
    void fromConfig_shouldLoadArenasCatalogAndSkills() {
        assertThat(battlefield.arenas()).containsKeys("arena-1", "arena-5", "sp-s3", "sp-s5").hasSize(8);
        assertThat(battlefield.grid().getArena().getName()).isEqualTo("Arena I");
        assertThat(battlefield.grid().getMaxTeamSize(Team.ALLY)).isEqualTo(5);
        assertThat(battlefield.catalog().rangeOf(93, 1)).isEqualTo(4);
        assertThat(battlefield.skills().getRegistry().size()).isEqualTo(20);
    }

    @Test
    void fromConfig_shouldRejectUnknownStartArena() {
        assertThatThrownBy(() -> Battlefield.fromConfig(
            ConfigFactory.parseString("hexarena.arena = nowhere").withFallback(ConfigFactory.load())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nowhere");
    }

    @Test
    void rangeProvider_shouldGiveCompanionsDeclaredOrOwnerRange() {
        IRangeProvider ranges = Battlefield.rangeProvider(battlefield.catalog(), battlefield.skills().getRegistry());

        assertThat(ranges.rangeOf(UnitId.main(66))).isEqualTo(3);
        assertThat(ranges.rangeOf(UnitId.main(999))).isEqualTo(Config.DEFAULT_UNIT_RANGE);
        assertThat(ranges.rangeOf(UnitId.companion(89, 2))).isEqualTo(3);
        assertThat(ranges.rangeOf(UnitId.companion(68, 1))).isEqualTo(1);
        assertThat(ranges.rangeOf(UnitId.companion(50, 1))).isEqualTo(1);
    }

    @Test
    void selectArena_shouldApplyStatesAndRejectUnknownKeys() {
        assertThat(battlefield.selectArena("arena-2")).isTrue();
        assertThat(battlefield.grid().getTileById(9).getState()).isEqualTo(TileState.BLOCKED);

        assertThat(battlefield.selectArena("sp-s3")).isTrue();
        assertThat(battlefield.grid().getTileById(4).getState()).isEqualTo(TileState.BLOCKED_BREAKABLE);

        assertThatThrownBy(() -> battlefield.selectArena("arena-9")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nameOf_shouldUseCatalogNames() {
        assertThat(battlefield.nameOf(UnitId.main(46))).isEqualTo("Vala");
        assertThat(battlefield.nameOf(UnitId.companion(68, 1))).isEqualTo("Elijah & Lailah #1");
        assertThat(battlefield.nameOf(UnitId.main(999))).isEqualTo("Unit 999");
    }

    @Test
    @DisplayName("two enemies four tiles away: ally melee picks the higher id, enemy melee the lower")
    void closestTargets_shouldResolveTiedScenario() {
        assertThat(battlefield.transactions().place(9, UnitId.main(46), Team.ALLY)).isTrue();
        assertThat(battlefield.transactions().place(33, UnitId.main(52), Team.ENEMY)).isTrue();
        assertThat(battlefield.transactions().place(37, UnitId.main(57), Team.ENEMY)).isTrue();

        Map<Integer, TargetInfo> allyView = battlefield.targets().closestTargetMap(Team.ALLY, Team.ENEMY);

        assertThat(allyView.get(9).targetTileId()).isEqualTo(37);
        assertThat(allyView.get(9).metadata()).containsEntry(TargetInfo.MOVEMENT_DISTANCE, 3);
        assertThat(battlefield.skills().getTarget(UnitId.main(46), Team.ALLY).targetTileId()).isEqualTo(33);
    }

    @Test
    void companionSkill_shouldSpawnReproduciblyFromSeed() {
        Battlefield twin = Battlefield.fromConfig(ConfigFactory.load());

        battlefield.transactions().place(9, UnitId.main(89), Team.ALLY);
        twin.transactions().place(9, UnitId.main(89), Team.ALLY);

        assertThat(battlefield.grid().getTeamSize(Team.ALLY)).isEqualTo(3);
        assertThat(battlefield.grid().snapshot()).isEqualTo(twin.grid().snapshot());
    }
}
