package org.hexarena.runtime.skill.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.TeamUnit;
import org.hexarena.runtime.model.Tile;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.skill.ISkill;
import org.hexarena.runtime.skill.SkillActivationException;
import org.hexarena.runtime.skill.SkillContext;
import org.hexarena.runtime.skill.SkillDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spawns {@code companionCount} companions of the caster on random free tiles of its team.
 * <p>
 * Team capacity is raised by the number of companions for as long as the skill is active.
 * Companions are linked to the caster on the grid, so removing either removes all of them.
 * Activation fails without side effects if there are fewer free tiles than companions. When the
 * skill is re-activated after a rolled-back deactivation, each companion returns to the tile it held
 * and no tile is drawn.
 */
public class CompanionSkill implements ISkill {

    private static final Logger LOG = LoggerFactory.getLogger(CompanionSkill.class);

    private final SkillDescriptor descriptor;

    public CompanionSkill(SkillDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public SkillDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public void onActivate(SkillContext context) throws SkillActivationException {
        SpatialGrid grid = context.grid();
        Team team = context.team();
        UnitId main = context.unit();
        int count = descriptor.companionCount();

        List<Tile> free = new ArrayList<>(grid.getAvailableTiles(team));
        if (free.size() < count) {
            throw new SkillActivationException("No space available for " + count + " companion(s) of " + main);
        }
        if (!grid.adjustMaxTeamSize(team, count)) {
            throw new SkillActivationException("Cannot raise " + team + " capacity by " + count);
        }
        context.state().addCapacityDelta(count);

        Map<UnitId, Integer> remembered = context.state().getRememberedCompanionTiles();
        for (int sequence = 1; sequence <= count; sequence++) {
            UnitId companion = UnitId.companion(main.mainId(), sequence);
            Integer previousTile = remembered.get(companion);
            Tile tile = previousTile != null
                ? takeTile(free, previousTile, companion)
                : free.remove(context.random().nextInt(free.size()));
            if (!grid.placeUnit(tile.getId(), companion, team)) {
                throw new SkillActivationException("Failed to place " + companion + " on tile " + tile.getId());
            }
            grid.addCompanionLink(main, team, companion);
            if (descriptor.companionColor() != null) {
                context.visuals().setUnitColor(context.owner(), new TeamUnit(companion, team), descriptor.companionColor());
            }
        }
    }

    private static Tile takeTile(List<Tile> free, int tileId, UnitId companion) throws SkillActivationException {
        for (int i = 0; i < free.size(); i++) {
            if (free.get(i).getId() == tileId) {
                return free.remove(i);
            }
        }
        throw new SkillActivationException("Tile " + tileId + " is no longer free for " + companion);
    }

    @Override
    public void onUpdate(SkillContext context) {
        // companions are spawned once, on activation
    }

    @Override
    public void onDeactivate(SkillContext context) {
        SpatialGrid grid = context.grid();
        Team team = context.team();
        UnitId main = context.unit();

        for (UnitId companion : grid.getCompanions(main, team)) {
            context.visuals().removeUnitColor(new TeamUnit(companion, team));
            int tileId = grid.findUnitTile(companion, team);
            if (tileId >= 0) {
                grid.removeUnit(tileId);
            }
        }
        grid.clearCompanionLinks(main, team);

        int delta = context.state().getCapacityDelta();
        if (delta != 0) {
            if (grid.adjustMaxTeamSize(team, -delta)) {
                context.state().addCapacityDelta(-delta);
            } else {
                LOG.warn("Failed to restore {} capacity after removing companions of {}", team, main);
            }
        }
    }
}
