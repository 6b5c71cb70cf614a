package org.hexarena.runtime.skill;

import org.hexarena.runtime.model.Team;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Behavior attached to a unit while it is on the board.
 * <p>
 * Lifecycle per (unit, team): {@code onActivate} once when placed, {@code onUpdate} after every
 * completed board transaction, {@code onDeactivate} once when removed. {@code onUpdate} only
 * recomputes derived state such as targets; it never spawns companions.
 * <p>
 * {@code onDeactivate} is also used to clean up after a failed {@code onActivate}, so it must cope
 * with a partially activated state.
 */
public interface ISkill {

    SkillDescriptor getDescriptor();

    /**
     * @throws SkillActivationException if the skill cannot be activated on the current board
     */
    void onActivate(SkillContext context) throws SkillActivationException;

    void onUpdate(SkillContext context);

    void onDeactivate(SkillContext context);

    /**
     * Tiles the skill takes over while active for a caster of {@code team}. The caller empties them
     * before activation and never places the caster on one.
     */
    default IntList claimedTiles(Team team) {
        return IntLists.emptyList();
    }
}
