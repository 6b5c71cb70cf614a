package org.hexarena.runtime.skill;

import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.TeamUnit;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.spi.IRandomProvider;
import org.hexarena.runtime.targeting.TargetResolver;

/**
 * Everything a skill hook may use. The caster is referenced by id and tile only.
 *
 * @param grid     the board
 * @param tileId   the caster's current tile
 * @param team     the caster's team
 * @param unit     the caster
 * @param state    the caster's skill state
 * @param engine   engine storing targets and visual modifiers
 * @param resolver target selection on the same board
 * @param random   randomness for companion placement
 */
public record SkillContext(
    SpatialGrid grid,
    int tileId,
    Team team,
    UnitId unit,
    SkillState state,
    SkillEngine engine,
    TargetResolver resolver,
    IRandomProvider random
) {

    public TeamUnit owner() {
        return new TeamUnit(unit, team);
    }

    public VisualModifierRegistry visuals() {
        return engine.getVisualModifiers();
    }
}
