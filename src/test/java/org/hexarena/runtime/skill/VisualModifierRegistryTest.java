package org.hexarena.runtime.skill;

import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.TeamUnit;
import org.hexarena.runtime.model.UnitId;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class VisualModifierRegistryTest {

    private static final TeamUnit CASSADEE = new TeamUnit(UnitId.main(10), Team.ALLY);
    private static final TeamUnit FARAMOR = new TeamUnit(UnitId.main(75), Team.ALLY);

    @Test
    void setTileColor_latestRegistrationShouldBeShown() {
        VisualModifierRegistry visuals = new VisualModifierRegistry();

        visuals.setTileColor(CASSADEE, 4, "#4fc3f7");
        visuals.setTileColor(FARAMOR, 4, "#6d9c86");

        assertThat(visuals.getTileColor(4)).isEqualTo("#6d9c86");

        visuals.setTileColor(CASSADEE, 4, "#4fc3f7");

        assertThat(visuals.getTileColor(4)).isEqualTo("#4fc3f7");
        assertThat(visuals.getTileColors()).containsOnlyKeys(4);
    }

    @Test
    void unregisterAll_shouldKeepOtherOwnersColorOnSharedTile() {
        VisualModifierRegistry visuals = new VisualModifierRegistry();
        visuals.setTileColor(CASSADEE, 4, "#4fc3f7");
        visuals.setTileColor(CASSADEE, 9, "#4fc3f7");
        visuals.setTileColor(FARAMOR, 4, "#6d9c86");

        visuals.unregisterAll(FARAMOR);

        assertThat(visuals.getTileColor(4)).isEqualTo("#4fc3f7");
        assertThat(visuals.getTileColor(9)).isEqualTo("#4fc3f7");

        visuals.unregisterAll(CASSADEE);

        assertThat(visuals.getTileColor(4)).isNull();
        assertThat(visuals.getTileColors()).isEmpty();
        assertThat(visuals.isEmpty()).isTrue();
    }

    @Test
    void unregisterTileColors_shouldLeaveOtherHintsOfTheOwner() {
        VisualModifierRegistry visuals = new VisualModifierRegistry();
        visuals.setTileColor(FARAMOR, 7, "#6d9c86");
        visuals.setTargetingColor(FARAMOR, "#6d9c86");

        visuals.unregisterTileColors(FARAMOR);

        assertThat(visuals.getTileColor(7)).isNull();
        assertThat(visuals.getTargetingColor(FARAMOR)).isEqualTo("#6d9c86");
    }
}
